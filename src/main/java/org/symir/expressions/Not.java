package org.symir.expressions;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.symir.core.Type;
import org.symir.symbolic.SymbolicStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * 逻辑非，类型为 BOOL，操作数必须是 BOOL。
 */
@Getter
public final class Not extends Expression {

    private static final Logger logger = LoggerFactory.getLogger(Not.class);

    private final Expression operand;

    public Not(Expression operand) {
        super(Type.BOOL);
        this.operand = Objects.requireNonNull(operand, "Not: operand cannot be null");
        requireType(operand, Type.BOOL, () -> "Not(" + operand + ")");
        logger.debug("创建了一个 Not: {}", this);
    }

    @Override
    public Expr evaluate(SymbolicStore store, int step) {
        return store.getCtx().mkNot((BoolExpr) operand.evaluate(store, step));
    }

    @Override
    void collectVariableNames(Set<String> names) {
        operand.collectVariableNames(names);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return operand.equals(((Not) o).operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Not.class, operand);
    }

    @Override
    public String toString() {
        // 二元表达式自带括号，不再重复加一层
        if (operand instanceof BinaryExpression) {
            return "!" + operand;
        }
        return "!(" + operand + ")";
    }
}
