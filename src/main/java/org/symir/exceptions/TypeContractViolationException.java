package org.symir.exceptions;

import lombok.Getter;
import org.symir.core.Type;

/**
 * 某个结构位置期望的类型标签与实际表达式的类型标签不一致。
 * 在构造表达式树或命令时抛出，保证不合法的树不会被构造出来。
 */
@Getter
public class TypeContractViolationException extends IrException {

    private final Type expected;
    // 实际的项不属于任何类型标签时 (例如 Real 项) 为 null
    private final Type actual;

    public TypeContractViolationException(Type expected, Type actual, String where) {
        super(String.format("%s: 期望类型 %s，实际为 %s", where, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * 用于外部提供的 Z3 项：其排序可能没有对应的类型标签。
     * @param actualSort 实际的 Z3 排序名。
     */
    public TypeContractViolationException(Type expected, String actualSort, String where) {
        super(String.format("%s: 期望类型 %s，实际排序为 %s", where, expected, actualSort));
        this.expected = expected;
        this.actual = null;
    }
}
