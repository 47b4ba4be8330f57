package org.symir.expressions;

/**
 * 算术减法 {@code (e1 - e2)}，类型为 NAT。结果可能为负，这里不做截断。
 */
public final class Minus extends BinaryExpression {

    public Minus(Expression left, Expression right) {
        super(Operator.MINUS, left, right);
    }
}
