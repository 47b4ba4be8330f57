package org.symir.commands;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 终止命令 {@code line: stop}：沿当前路径不存在后继步骤。
 */
public final class Stop extends Command {

    private static final Logger logger = LoggerFactory.getLogger(Stop.class);

    public Stop(int line) {
        super(line);
        logger.debug("创建了一个 Stop: {}", this);
    }

    @Override
    public List<Integer> successors() {
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return getLine() == ((Stop) o).getLine();
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(getLine());
    }

    @Override
    public String toString() {
        return getLine() + ": stop";
    }
}
