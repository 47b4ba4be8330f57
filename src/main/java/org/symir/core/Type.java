package org.symir.core;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;

/**
 * 表达式的类型标签。每个表达式节点在构造时被永久地标记为其中之一。
 * 不存在隐式转换。
 */
public enum Type {

    /**
     * 布尔值
     */
    BOOL,
    /**
     * 自然数 (在 Z3 中以 Int 表示)
     */
    NAT;

    /**
     * 返回此类型标签对应的 Z3 Sort。
     * @param ctx Z3 Context 实例。
     * @return BOOL 对应 Bool sort，NAT 对应 Int sort。
     */
    public Sort toZ3Sort(Context ctx) {
        return switch (this) {
            case BOOL -> ctx.mkBoolSort();
            case NAT -> ctx.mkIntSort();
        };
    }

    /**
     * 检查一个 Z3 项的 sort 是否与此类型标签一致。
     */
    public boolean accepts(Expr term) {
        return switch (this) {
            case BOOL -> term.isBool();
            case NAT -> term.isInt();
        };
    }
}
