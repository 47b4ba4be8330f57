package org.symir.expressions;

/**
 * 算术乘法 {@code (e1 * e2)}，类型为 NAT。
 */
public final class Product extends BinaryExpression {

    public Product(Expression left, Expression right) {
        super(Operator.PRODUCT, left, right);
    }
}
