package org.symir.expressions;

import com.microsoft.z3.BoolExpr;
import org.symir.symbolic.SymbolicStore;

/**
 * 定义在某个步骤上生成 Z3 布尔断言 (BoolExpr) 的接口。
 */
public interface ToZ3BoolExpr {

    /**
     * 生成此对象在指定步骤上的 Z3 布尔断言。
     * @param store 符号存储，提供 Z3 Context 和各变量每一步的符号项。
     * @param step 步骤下标。
     * @return 对应的 Z3 BoolExpr。
     */
    BoolExpr toZ3BoolExpr(SymbolicStore store, int step);
}
