package org.symir.program;

import lombok.Getter;
import org.symir.commands.Assign;
import org.symir.commands.Command;
import org.symir.commands.GoTo;
import org.symir.exceptions.DanglingJumpTargetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 代表一个程序：从行号到唯一命令的映射，加上指定的入口行。
 * 构造时检查加载器的约定 (行号唯一、入口存在、每个 goto 目标都存在)，
 * 违反约定的程序在任何展开开始之前就被拒绝。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class Program {

    private static final Logger logger = LoggerFactory.getLogger(Program.class);

    private final SortedMap<Integer, Command> commands;
    private final int entryLine;

    private Program(SortedMap<Integer, Command> commands, int entryLine) {
        this.commands = Collections.unmodifiableSortedMap(commands);
        this.entryLine = entryLine;
    }

    /**
     * 工厂方法：从命令集合构造程序。
     *
     * @param commands  程序中的所有命令。
     * @param entryLine 入口行。
     * @return 校验通过的 Program。
     * @throws IllegalArgumentException     如果行号重复或入口行不存在。
     * @throws DanglingJumpTargetException 如果某个 goto 的目标行没有命令。
     */
    public static Program of(Collection<? extends Command> commands, int entryLine) {
        Objects.requireNonNull(commands, "Commands cannot be null.");
        SortedMap<Integer, Command> table = new TreeMap<>();
        for (Command command : commands) {
            Objects.requireNonNull(command, "Command cannot be null.");
            Command previous = table.putIfAbsent(command.getLine(), command);
            if (previous != null) {
                logger.error("Program.of: 第 {} 行存在重复命令: {} 和 {}", command.getLine(), previous, command);
                throw new IllegalArgumentException("Duplicate command for line " + command.getLine());
            }
        }
        if (!table.containsKey(entryLine)) {
            logger.error("Program.of: 入口行 {} 不存在", entryLine);
            throw new IllegalArgumentException("Entry line " + entryLine + " has no command");
        }
        for (Command command : table.values()) {
            if (!(command instanceof GoTo)) {
                continue;
            }
            GoTo goTo = (GoTo) command;
            if (!table.containsKey(goTo.getOtherLine())) {
                logger.error("Program.of: 第 {} 行的 goto 目标 {} 不存在", goTo.getLine(), goTo.getOtherLine());
                throw new DanglingJumpTargetException(goTo.getLine(), goTo.getOtherLine());
            }
        }
        logger.info("创建 Program: {} 条命令，入口行 {}", table.size(), entryLine);
        return new Program(table, entryLine);
    }

    /**
     * 获取指定行的命令。
     * @throws NoSuchElementException 如果该行没有命令。
     */
    public Command getCommand(int line) {
        return findCommand(line).orElseThrow(() -> {
            logger.error("getCommand: 第 {} 行没有命令", line);
            return new NoSuchElementException("No command at line " + line);
        });
    }

    public Optional<Command> findCommand(int line) {
        return Optional.ofNullable(commands.get(line));
    }

    public Command getEntryCommand() {
        return commands.get(entryLine);
    }

    /**
     * 计算指定行在状态机中的后继，只保留程序中存在的行。
     * 落到最后一行之后视为没有后继。
     * @param line 当前行。
     * @return 不可修改的后继行号列表。
     */
    public List<Integer> successorsOf(int line) {
        return getCommand(line).successors().stream()
                .filter(commands::containsKey)
                .toList();
    }

    /**
     * @return 如果该行是 stop，或者在程序内没有任何后继，则返回 true。
     */
    public boolean isTerminal(int line) {
        return getCommand(line).isTerminal() || successorsOf(line).isEmpty();
    }

    /**
     * 收集程序中出现的所有变量名：赋值目标，以及所有表达式读取的变量。
     * 可以直接用来初始化 {@link org.symir.symbolic.SymbolicStore}。
     */
    public SortedSet<String> getVariableNames() {
        SortedSet<String> names = new TreeSet<>();
        for (Command command : commands.values()) {
            if (command instanceof Assign) {
                Assign assign = (Assign) command;
                names.add(assign.getVariable().getName());
                names.addAll(assign.getExpression().getVariableNames());
            } else if (command instanceof GoTo) {
                GoTo goTo = (GoTo) command;
                names.addAll(goTo.getCondition().getVariableNames());
            }
        }
        return Collections.unmodifiableSortedSet(names);
    }

    @Override
    public String toString() {
        return commands.values().stream()
                .map(Command::toString)
                .collect(Collectors.joining("\n"));
    }
}
