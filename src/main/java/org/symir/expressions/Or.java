package org.symir.expressions;

/**
 * 析取 {@code (e1 || e2)}，类型为 BOOL。
 */
public final class Or extends BinaryExpression {

    public Or(Expression left, Expression right) {
        super(Operator.OR, left, right);
    }
}
