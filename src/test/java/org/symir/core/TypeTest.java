package org.symir.core;

import org.symir.symbolic.Z3TestOracle;
import com.microsoft.z3.Context;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TypeTest {

    private Z3TestOracle oracle;
    private Context ctx;

    @BeforeAll
    void setUp() {
        oracle = new Z3TestOracle();
        ctx = oracle.getCtx();
    }

    @AfterAll
    void tearDown() {
        if (oracle != null) {
            oracle.close();
        }
    }

    @Test
    @DisplayName("类型标签应映射到对应的 Z3 sort")
    void testToZ3Sort() {
        assertAll(
                () -> assertEquals(ctx.mkBoolSort(), Type.BOOL.toZ3Sort(ctx)),
                () -> assertEquals(ctx.mkIntSort(), Type.NAT.toZ3Sort(ctx))
        );
    }

    @Test
    @DisplayName("accepts 只接受 sort 一致的项")
    void testAccepts() {
        assertAll(
                () -> assertTrue(Type.BOOL.accepts(ctx.mkTrue())),
                () -> assertFalse(Type.BOOL.accepts(ctx.mkInt(1))),
                () -> assertTrue(Type.NAT.accepts(ctx.mkIntConst("n"))),
                () -> assertFalse(Type.NAT.accepts(ctx.mkBoolConst("b")))
        );
    }
}
