package org.symir.commands;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 程序中的一条命令，带有源码行号。
 * 行号在程序内唯一，既是 goto 的目标，也是命令表的索引。
 * 命令本身不执行，只向展开器暴露结构字段，以及它在状态机中的后继行。
 * 此类及其子类都是不可变的。
 * @author Ayalyt
 */
@Getter
public abstract sealed class Command implements Comparable<Command> permits Assign, GoTo, Stop {

    private static final Logger logger = LoggerFactory.getLogger(Command.class);

    private final int line;

    protected Command(int line) {
        if (line < 0) {
            logger.error("Command-构造函数: 行号不能为负数: {}", line);
            throw new IllegalArgumentException("Command line must be non-negative: " + line);
        }
        this.line = line;
    }

    /**
     * 状态机视角下此命令的后继行号。
     * Assign 有一个后继 (line + 1)，GoTo 总是给出两个后继 (line + 1 和目标行)，Stop 没有后继。
     * 不检查后继行是否真的存在于程序中，这由 {@link org.symir.program.Program} 负责。
     * @return 不可修改的后继行号列表。
     */
    public abstract List<Integer> successors();

    /**
     * @return 没有后继时返回 true。
     */
    public boolean isTerminal() {
        return successors().isEmpty();
    }

    @Override
    public int compareTo(Command other) {
        return Integer.compare(this.line, other.line);
    }
}
