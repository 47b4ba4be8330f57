package org.symir.expressions;

/**
 * 整数除法 {@code (e1 / e2)}，类型为 NAT。
 * <p>
 * 除数为零不在这里检查。生成的是 Z3 的整数 {@code div} 项：Z3 把 {@code div} 视为全函数，
 * {@code x div 0} 是一个未指定的 Int 值 (相当于一个未解释函数在 x 上的取值)，
 * 是否可能除零完全交给求解器判断。
 */
public final class Division extends BinaryExpression {

    public Division(Expression left, Expression right) {
        super(Operator.DIVISION, left, right);
    }
}
