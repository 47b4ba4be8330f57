package org.symir.commands;

import com.microsoft.z3.BoolExpr;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.symir.core.Type;
import org.symir.expressions.Expression;
import org.symir.expressions.ToZ3BoolExpr;
import org.symir.symbolic.SymbolicStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 条件跳转 {@code line: condition => goto otherLine}。
 * 条件成立时控制转到 otherLine，否则落到 line + 1。
 * 两个后继总是同时给出，即使条件在静态上恒真或恒假。
 * @author Ayalyt
 */
@Getter
public final class GoTo extends Command implements ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(GoTo.class);

    private final Expression condition;
    private final int otherLine;

    /**
     * @param line 行号。
     * @param condition 跳转条件，必须是 BOOL。
     * @param otherLine 条件成立时的目标行。
     * @throws org.symir.exceptions.TypeContractViolationException 如果条件不是 BOOL。
     */
    public GoTo(int line, Expression condition, int otherLine) {
        super(line);
        this.condition = Objects.requireNonNull(condition, "GoTo: condition cannot be null");
        Expression.requireType(condition, Type.BOOL, () -> "GoTo(" + line + ") condition");
        if (otherLine < 0) {
            logger.error("GoTo-构造函数: 目标行不能为负数: {}", otherLine);
            throw new IllegalArgumentException("GoTo target line must be non-negative: " + otherLine);
        }
        this.otherLine = otherLine;
        logger.debug("创建了一个 GoTo: {}", this);
    }

    public int getFallThroughLine() {
        return getLine() + 1;
    }

    @Override
    public List<Integer> successors() {
        if (otherLine == getFallThroughLine()) {
            return List.of(otherLine);
        }
        return List.of(getFallThroughLine(), otherLine);
    }

    /**
     * 跳转分支的断言：条件在第 step 步成立。
     */
    @Override
    public BoolExpr toZ3BoolExpr(SymbolicStore store, int step) {
        return condition.evaluateBool(store, step);
    }

    /**
     * 落空分支的断言：条件在第 step 步不成立。
     */
    public BoolExpr fallThroughCondition(SymbolicStore store, int step) {
        return store.getCtx().mkNot(condition.evaluateBool(store, step));
    }

    /**
     * 两个分支，每个分支是 (后继行, 该分支的断言)。跳转分支在前。
     */
    public List<Pair<Integer, BoolExpr>> branches(SymbolicStore store, int step) {
        BoolExpr taken = toZ3BoolExpr(store, step);
        return List.of(
                Pair.of(otherLine, taken),
                Pair.of(getFallThroughLine(), store.getCtx().mkNot(taken)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GoTo that = (GoTo) o;
        return getLine() == that.getLine() && otherLine == that.otherLine && condition.equals(that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLine(), condition, otherLine);
    }

    @Override
    public String toString() {
        return getLine() + ": " + condition + " => goto " + otherLine;
    }
}
