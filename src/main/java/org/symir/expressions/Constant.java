package org.symir.expressions;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.symir.core.Type;
import org.symir.symbolic.SymbolicStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * 字面常量，类型为 BOOL 或 NAT，值在构造时固定。
 * 求值不读取存储中的任何变量，对所有步骤下标都得到同一个值。
 * @author Ayalyt
 */
public final class Constant extends Expression {

    private static final Logger logger = LoggerFactory.getLogger(Constant.class);

    public static final Constant TRUE = new Constant(Type.BOOL, 0L, true);
    public static final Constant FALSE = new Constant(Type.BOOL, 0L, false);
    public static final Constant ZERO = new Constant(Type.NAT, 0L, false);

    // 只有与类型标签对应的那个字段有意义
    private final long natValue;
    private final boolean boolValue;

    private Constant(Type type, long natValue, boolean boolValue) {
        super(type);
        this.natValue = natValue;
        this.boolValue = boolValue;
        logger.debug("创建了一个Constant: {} ({})", this, type);
    }

    /**
     * 工厂方法：创建 NAT 常量。
     * @param value 自然数字面量。
     * @throws IllegalArgumentException 如果 value 为负数。
     */
    public static Constant nat(long value) {
        if (value < 0) {
            logger.error("Constant.nat: NAT 常量不能为负数: {}", value);
            throw new IllegalArgumentException("NAT constant must be non-negative: " + value);
        }
        return value == 0 ? ZERO : new Constant(Type.NAT, value, false);
    }

    /**
     * 工厂方法：创建 BOOL 常量。
     */
    public static Constant bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * @return NAT 常量的值。
     * @throws org.symir.exceptions.TypeContractViolationException 如果这是 BOOL 常量。
     */
    public long getNatValue() {
        requireType(this, Type.NAT, "Constant.getNatValue");
        return natValue;
    }

    /**
     * @return BOOL 常量的值。
     * @throws org.symir.exceptions.TypeContractViolationException 如果这是 NAT 常量。
     */
    public boolean getBoolValue() {
        requireType(this, Type.BOOL, "Constant.getBoolValue");
        return boolValue;
    }

    @Override
    public Expr evaluate(SymbolicStore store, int step) {
        Context ctx = store.getCtx();
        return switch (getType()) {
            case BOOL -> ctx.mkBool(boolValue);
            case NAT -> ctx.mkInt(natValue);
        };
    }

    @Override
    void collectVariableNames(Set<String> names) {
        // 常量不引用变量
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Constant that = (Constant) o;
        return getType() == that.getType() && natValue == that.natValue && boolValue == that.boolValue;
    }

    @Override
    public int hashCode() {
        return Objects.hash(getType(), natValue, boolValue);
    }

    @Override
    public String toString() {
        return switch (getType()) {
            case BOOL -> Boolean.toString(boolValue);
            case NAT -> Long.toString(natValue);
        };
    }
}
