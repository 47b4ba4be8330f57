package org.symir.program;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.symir.commands.Assign;
import org.symir.commands.Command;
import org.symir.commands.GoTo;
import org.symir.commands.Stop;
import org.symir.core.Variable;
import org.symir.exceptions.DanglingJumpTargetException;
import org.symir.expressions.*;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProgramTest {

    private static final VariableValue X = new VariableValue("x");
    private static final VariableValue N = new VariableValue("n");

    /**
     * 0: x = 0
     * 1: (n < x) => goto 4
     * 2: x = (x + 1)
     * 3: true => goto 1
     * 4: stop
     */
    private static List<Command> countingLoop() {
        return List.of(
                new Assign(0, Variable.of("x"), Constant.nat(0)),
                new GoTo(1, new Less(N, X), 4),
                new Assign(2, Variable.of("x"), new Plus(X, Constant.nat(1))),
                new GoTo(3, Constant.TRUE, 1),
                new Stop(4));
    }

    @Nested
    @DisplayName("加载约定 (Loader contract)")
    class ValidationTests {

        @Test
        @DisplayName("合法程序按行号建立命令表")
        void testValidProgram() {
            Program program = Program.of(countingLoop(), 0);

            assertAll(
                    () -> assertEquals(5, program.getCommands().size()),
                    () -> assertEquals(0, program.getEntryLine()),
                    () -> assertEquals("0: x = 0", program.getEntryCommand().toString()),
                    () -> assertInstanceOf(Stop.class, program.getCommand(4)),
                    () -> assertTrue(program.findCommand(9).isEmpty()),
                    () -> assertThrows(NoSuchElementException.class, () -> program.getCommand(9))
            );
        }

        @Test
        @DisplayName("悬空的 goto 目标在展开前就被报告")
        void testDanglingJumpTarget() {
            List<Command> commands = List.of(
                    new GoTo(0, new Equal(X, Constant.nat(0)), 10),
                    new Stop(1));

            DanglingJumpTargetException e = assertThrows(DanglingJumpTargetException.class,
                    () -> Program.of(commands, 0));
            assertAll(
                    () -> assertEquals(0, e.getLine()),
                    () -> assertEquals(10, e.getTarget())
            );
        }

        @Test
        @DisplayName("重复的行号应被拒绝")
        void testDuplicateLines() {
            List<Command> commands = List.of(new Stop(0), new Assign(0, Variable.of("x"), X));
            assertThrows(IllegalArgumentException.class, () -> Program.of(commands, 0));
        }

        @Test
        @DisplayName("入口行必须存在")
        void testMissingEntry() {
            assertThrows(IllegalArgumentException.class, () -> Program.of(List.of(new Stop(0)), 3));
        }
    }

    @Nested
    @DisplayName("状态机 (State machine)")
    class StateMachineTests {

        @Test
        @DisplayName("successorsOf 给出程序内存在的后继")
        void testSuccessors() {
            Program program = Program.of(countingLoop(), 0);

            assertAll(
                    () -> assertEquals(List.of(1), program.successorsOf(0)),
                    () -> assertEquals(Set.of(2, 4), Set.copyOf(program.successorsOf(1))),
                    () -> assertEquals(Set.of(4, 1), Set.copyOf(program.successorsOf(3))),
                    () -> assertTrue(program.successorsOf(4).isEmpty())
            );
        }

        @Test
        @DisplayName("stop 行和落出程序末尾的行是终止状态")
        void testTerminalStates() {
            Program program = Program.of(List.of(
                    new Assign(0, Variable.of("x"), Constant.nat(1)),
                    new Stop(1),
                    new Assign(5, Variable.of("x"), X)), 0);

            assertAll(
                    () -> assertFalse(program.isTerminal(0)),
                    () -> assertTrue(program.isTerminal(1)),
                    () -> assertTrue(program.isTerminal(5), "落到不存在的第 6 行视为终止")
            );
        }
    }

    @Test
    @DisplayName("getVariableNames 收集赋值目标和所有读取的变量")
    void testVariableNames() {
        Program program = Program.of(countingLoop(), 0);
        assertEquals(Set.of("n", "x"), program.getVariableNames());
    }

    @Test
    @DisplayName("toString 按行号升序逐行渲染")
    void testRendering() {
        Program program = Program.of(countingLoop(), 0);
        String expected = String.join("\n",
                "0: x = 0",
                "1: (n < x) => goto 4",
                "2: x = (x + 1)",
                "3: true => goto 1",
                "4: stop");
        assertEquals(expected, program.toString());
    }
}
