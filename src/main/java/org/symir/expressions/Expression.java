package org.symir.expressions;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.symir.core.Type;
import org.symir.exceptions.TypeContractViolationException;
import org.symir.symbolic.SymbolicStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * 表达式树的节点。
 * 每个节点在构造时被永久标记一个 {@link Type}，子节点由父节点独占 (严格的树，无共享、无环)。
 * 构造函数会检查子节点的类型标签，类型不合法的树无法被构造出来。
 * 节点是不可变的，可以被多个展开过程同时读取。
 * <p>
 * 变体集合是封闭的：{@link VariableValue}, {@link Constant}, {@link BinaryExpression} 的八个子类和 {@link Not}。
 * @author Ayalyt
 */
@Getter
public abstract sealed class Expression permits VariableValue, Constant, BinaryExpression, Not {

    private static final Logger logger = LoggerFactory.getLogger(Expression.class);

    private final Type type;

    protected Expression(Type type) {
        this.type = Objects.requireNonNull(type, "Expression type cannot be null");
    }

    /**
     * 在给定的符号存储和步骤下标上结构化地求值，得到一个 Z3 符号项。
     * 纯函数：不修改 store，对同一 (store, step) 重复调用得到等价的项。
     * 返回项的 sort 与此节点的类型标签一致 (BOOL 对应 Bool，NAT 对应 Int)。
     *
     * @param store 符号存储。
     * @param step 步骤下标，所有子节点都在同一下标上求值。
     * @return Z3 符号项。
     * @throws org.symir.exceptions.UnboundVariableException 如果引用的变量不在 store 中。
     * @throws org.symir.exceptions.StepIndexOutOfRangeException 如果 step 超出引用变量的已填充范围。
     */
    public abstract Expr evaluate(SymbolicStore store, int step);

    /**
     * 对 NAT 节点求值并返回 Z3 算术项。
     * @throws TypeContractViolationException 如果此节点不是 NAT。
     */
    public final ArithExpr evaluateArith(SymbolicStore store, int step) {
        requireType(this, Type.NAT, "evaluateArith");
        return (ArithExpr) evaluate(store, step);
    }

    /**
     * 对 BOOL 节点求值并返回 Z3 布尔项，可直接用于求解器断言。
     * @throws TypeContractViolationException 如果此节点不是 BOOL。
     */
    public final BoolExpr evaluateBool(SymbolicStore store, int step) {
        requireType(this, Type.BOOL, "evaluateBool");
        return (BoolExpr) evaluate(store, step);
    }

    /**
     * 返回此表达式中所有 {@link VariableValue} 叶子引用的变量名 (有序)。
     * 调用者可以据此在求值前检查符号存储是否覆盖了这个表达式。
     */
    public final Set<String> getVariableNames() {
        SortedSet<String> names = new TreeSet<>();
        collectVariableNames(names);
        return Collections.unmodifiableSortedSet(names);
    }

    abstract void collectVariableNames(Set<String> names);

    /**
     * 检查表达式的类型标签，不一致时抛出 {@link TypeContractViolationException}。
     * @param expression 被检查的表达式。
     * @param expected 期望的类型标签。
     * @param where 出错位置的描述，用于错误信息。
     */
    public static void requireType(Expression expression, Type expected, String where) {
        if (expression.getType() != expected) {
            logger.error("{}: 期望类型 {}，但表达式 {} 的类型为 {}", where, expected, expression, expression.getType());
            throw new TypeContractViolationException(expected, expression.getType(), where);
        }
    }

    /**
     * 同 {@link #requireType(Expression, Type, String)}，但出错位置的描述只在检查失败时才生成。
     * 描述中含有子树的渲染结果时应使用这个版本。
     */
    public static void requireType(Expression expression, Type expected, Supplier<String> where) {
        if (expression.getType() != expected) {
            requireType(expression, expected, where.get());
        }
    }
}
