package org.symir.expressions;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.symir.core.Type;

/**
 * 二元运算符：渲染符号、操作数类型、结果类型，以及对应的 Z3 组合子。
 */
@Getter
public enum Operator {

    PLUS("+", Type.NAT, Type.NAT),
    MINUS("-", Type.NAT, Type.NAT),
    PRODUCT("*", Type.NAT, Type.NAT),
    // Z3 整数 div：x div 0 是一个未指定的 Int 值，不在这里做任何保护
    DIVISION("/", Type.NAT, Type.NAT),
    // 两个操作数类型相同即可 (NAT/NAT 或 BOOL/BOOL)
    EQUAL("==", null, Type.BOOL),
    LESS("<", Type.NAT, Type.BOOL),
    AND("&&", Type.BOOL, Type.BOOL),
    OR("||", Type.BOOL, Type.BOOL);

    private final String symbol;
    private final Type operandType;
    private final Type resultType;

    Operator(String symbol, Type operandType, Type resultType) {
        this.symbol = symbol;
        this.operandType = operandType;
        this.resultType = resultType;
    }

    /**
     * 检查两个操作数的类型标签是否满足此运算符的要求。
     * @return 满足时返回 true。
     */
    public boolean acceptsOperands(Type left, Type right) {
        if (operandType == null) {
            return left == right;
        }
        return left == operandType && right == operandType;
    }

    /**
     * 用对应的 Z3 组合子组合两个已经求值的子项。
     * 调用者保证子项的 sort 与操作数类型一致。
     */
    public Expr apply(Context ctx, Expr left, Expr right) {
        return switch (this) {
            case PLUS -> ctx.mkAdd((ArithExpr) left, (ArithExpr) right);
            case MINUS -> ctx.mkSub((ArithExpr) left, (ArithExpr) right);
            case PRODUCT -> ctx.mkMul((ArithExpr) left, (ArithExpr) right);
            case DIVISION -> ctx.mkDiv((ArithExpr) left, (ArithExpr) right);
            case EQUAL -> ctx.mkEq(left, right);
            case LESS -> ctx.mkLt((ArithExpr) left, (ArithExpr) right);
            case AND -> ctx.mkAnd((BoolExpr) left, (BoolExpr) right);
            case OR -> ctx.mkOr((BoolExpr) left, (BoolExpr) right);
        };
    }
}
