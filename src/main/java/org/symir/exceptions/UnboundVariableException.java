package org.symir.exceptions;

import lombok.Getter;

/**
 * 变量名在符号存储 (或程序) 中不存在。
 */
@Getter
public class UnboundVariableException extends IrException {

    private final String variableName;

    public UnboundVariableException(String variableName) {
        super("变量 '" + variableName + "' 未绑定到符号存储中");
        this.variableName = variableName;
    }
}
