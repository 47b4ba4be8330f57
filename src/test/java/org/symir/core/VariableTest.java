package org.symir.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VariableTest {

    @Test
    @DisplayName("同名变量相等，toString 为变量名")
    void testEqualityAndRendering() {
        Variable x1 = Variable.of("x");
        Variable x2 = Variable.of("x");

        assertAll(
                () -> assertEquals(x1, x2),
                () -> assertEquals(x1.hashCode(), x2.hashCode()),
                () -> assertNotEquals(x1, Variable.of("y")),
                () -> assertEquals("x", x1.toString()),
                () -> assertTrue(x1.compareTo(Variable.of("y")) < 0)
        );
    }

    @Test
    @DisplayName("空白或 null 的变量名应被拒绝")
    void testInvalidNames() {
        assertThrows(IllegalArgumentException.class, () -> Variable.of("  "));
        assertThrows(NullPointerException.class, () -> Variable.of(null));
    }
}
