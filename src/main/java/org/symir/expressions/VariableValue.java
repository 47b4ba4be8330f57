package org.symir.expressions;

import com.microsoft.z3.Expr;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.symir.core.Type;
import org.symir.symbolic.SymbolicStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * 读取变量的表达式叶子，类型恒为 NAT。
 * 求值结果就是 store[name][step]。
 */
@Getter
public final class VariableValue extends Expression {

    private static final Logger logger = LoggerFactory.getLogger(VariableValue.class);

    private final String name;

    public VariableValue(String name) {
        super(Type.NAT);
        Objects.requireNonNull(name, "VariableValue name cannot be null");
        if (StringUtils.isBlank(name)) {
            logger.error("VariableValue-构造函数: 变量名不能为空白");
            throw new IllegalArgumentException("VariableValue name cannot be blank");
        }
        this.name = name;
    }

    @Override
    public Expr evaluate(SymbolicStore store, int step) {
        return store.lookup(name, step);
    }

    @Override
    void collectVariableNames(Set<String> names) {
        names.add(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((VariableValue) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
