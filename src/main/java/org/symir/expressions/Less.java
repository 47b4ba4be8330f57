package org.symir.expressions;

/**
 * 小于 {@code (e1 < e2)}，类型为 BOOL，操作数必须是 NAT。
 */
public final class Less extends BinaryExpression {

    public Less(Expression left, Expression right) {
        super(Operator.LESS, left, right);
    }
}
