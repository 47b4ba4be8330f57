package org.symir.expressions;

/**
 * 相等 {@code (e1 == e2)}，类型为 BOOL。两个操作数的类型标签必须相同。
 */
public final class Equal extends BinaryExpression {

    public Equal(Expression left, Expression right) {
        super(Operator.EQUAL, left, right);
    }
}
