package org.symir.core;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 赋值语句左侧的变量引用。
 * 与读侧的 {@link org.symir.expressions.VariableValue} 不同，它不携带类型标签，
 * 类型由每个使用点上被赋的表达式决定。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class Variable implements Comparable<Variable> {

    private static final Logger logger = LoggerFactory.getLogger(Variable.class);

    private final String name;

    private Variable(String name) {
        Objects.requireNonNull(name, "Variable name cannot be null");
        if (StringUtils.isBlank(name)) {
            logger.error("Variable-构造函数: 变量名不能为空白");
            throw new IllegalArgumentException("Variable name cannot be blank");
        }
        this.name = name;
        logger.debug("创建了一个Variable: {}", name);
    }

    public static Variable of(String name) {
        return new Variable(name);
    }

    @Override
    public int compareTo(Variable other) {
        return this.name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Variable variable = (Variable) o;
        return name.equals(variable.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
