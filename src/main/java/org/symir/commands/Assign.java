package org.symir.commands;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.symir.core.Type;
import org.symir.core.Variable;
import org.symir.expressions.Expression;
import org.symir.expressions.ToZ3BoolExpr;
import org.symir.symbolic.SymbolicStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 赋值命令 {@code line: var = expr}。
 * 赋值被建模为连接相邻两步的等式约束，而不是原地修改：
 * 第 i 步的断言是 {@code store[var][i + 1] == expr.evaluate(store, i)}。
 * @author Ayalyt
 */
@Getter
public final class Assign extends Command implements ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(Assign.class);

    private final Variable variable;
    private final Expression expression;

    /**
     * @param line 行号。
     * @param variable 赋值目标。
     * @param expression 被赋的表达式，必须是 NAT (符号存储中的变量都是整数项)。
     * @throws org.symir.exceptions.TypeContractViolationException 如果表达式不是 NAT。
     */
    public Assign(int line, Variable variable, Expression expression) {
        super(line);
        this.variable = Objects.requireNonNull(variable, "Assign: variable cannot be null");
        this.expression = Objects.requireNonNull(expression, "Assign: expression cannot be null");
        Expression.requireType(expression, Type.NAT, () -> "Assign(" + line + ", " + variable + ")");
        logger.debug("创建了一个 Assign: {}", this);
    }

    @Override
    public List<Integer> successors() {
        return List.of(getLine() + 1);
    }

    /**
     * 第 step 步的赋值约束：{@code store[var][step + 1] == expr.evaluate(store, step)}。
     * @throws org.symir.exceptions.StepIndexOutOfRangeException 如果存储中还没有 step + 1 步。
     */
    @Override
    public BoolExpr toZ3BoolExpr(SymbolicStore store, int step) {
        ArithExpr next = store.lookup(variable.getName(), step + 1);
        ArithExpr value = expression.evaluateArith(store, step);
        return store.getCtx().mkEq(next, value);
    }

    /**
     * 第 step 步的帧约束：存储中除赋值目标以外的每个变量在 step + 1 步保持原值。
     * 与 {@link #toZ3BoolExpr} 合取后即完整描述了这一步。
     * @return 所有保持约束的合取，没有其他变量时为 true。
     */
    public BoolExpr frameConstraint(SymbolicStore store, int step) {
        Context ctx = store.getCtx();
        List<BoolExpr> unchanged = new ArrayList<>();
        for (String name : store.getVariableNames()) {
            if (!name.equals(variable.getName())) {
                unchanged.add(ctx.mkEq(store.lookup(name, step + 1), store.lookup(name, step)));
            }
        }
        if (unchanged.isEmpty()) {
            return ctx.mkTrue();
        }
        return ctx.mkAnd(unchanged.toArray(new BoolExpr[0]));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Assign that = (Assign) o;
        return getLine() == that.getLine() && variable.equals(that.variable) && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLine(), variable, expression);
    }

    @Override
    public String toString() {
        return getLine() + ": " + variable.getName() + " = " + expression;
    }
}
