package org.symir.expressions;

/**
 * 算术加法 {@code (e1 + e2)}，类型为 NAT。
 */
public final class Plus extends BinaryExpression {

    public Plus(Expression left, Expression right) {
        super(Operator.PLUS, left, right);
    }
}
