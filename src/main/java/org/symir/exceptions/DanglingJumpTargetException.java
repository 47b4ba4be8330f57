package org.symir.exceptions;

import lombok.Getter;

/**
 * goto 的目标行在程序中没有对应的命令。在任何展开开始之前报告。
 */
@Getter
public class DanglingJumpTargetException extends IrException {

    private final int line;
    private final int target;

    public DanglingJumpTargetException(int line, int target) {
        super(String.format("第 %d 行的 goto 目标 %d 不存在", line, target));
        this.line = line;
        this.target = target;
    }
}
