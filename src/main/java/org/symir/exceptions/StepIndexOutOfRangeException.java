package org.symir.exceptions;

import lombok.Getter;

/**
 * 步骤下标超出了某个变量已填充的符号项序列的范围。不做任何截断或补齐。
 */
@Getter
public class StepIndexOutOfRangeException extends IrException {

    private final String variableName;
    private final int step;
    private final int depth;

    public StepIndexOutOfRangeException(String variableName, int step, int depth) {
        super(String.format("变量 '%s' 的步骤下标 %d 越界，已填充范围为 [0, %d)", variableName, step, depth));
        this.variableName = variableName;
        this.step = step;
        this.depth = depth;
    }
}
