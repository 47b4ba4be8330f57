package org.symir.expressions;

/**
 * 合取 {@code (e1 && e2)}，类型为 BOOL。
 */
public final class And extends BinaryExpression {

    public And(Expression left, Expression right) {
        super(Operator.AND, left, right);
    }
}
