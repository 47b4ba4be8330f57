package org.symir.expressions;

import com.microsoft.z3.Expr;
import lombok.Getter;
import org.symir.core.Type;
import org.symir.exceptions.TypeContractViolationException;
import org.symir.symbolic.SymbolicStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * 二元表达式的公共实现。
 * 求值时两个子节点在同一个步骤下标上求值，再用 {@link Operator} 对应的 Z3 组合子组合。
 * 渲染为完全加括号的中缀形式，例如 {@code (2 + x)}。
 * @author Ayalyt
 */
@Getter
public abstract sealed class BinaryExpression extends Expression
        permits Plus, Minus, Product, Division, Equal, Less, And, Or {

    private static final Logger logger = LoggerFactory.getLogger(BinaryExpression.class);

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    /**
     * @param operator 运算符。
     * @param left 左操作数。
     * @param right 右操作数。
     * @throws NullPointerException 如果任何参数为 null。
     * @throws TypeContractViolationException 如果操作数类型不满足运算符的要求。
     */
    protected BinaryExpression(Operator operator, Expression left, Expression right) {
        super(Objects.requireNonNull(operator, "Operator cannot be null").getResultType());
        this.operator = operator;
        this.left = Objects.requireNonNull(left, operator + ": left operand cannot be null");
        this.right = Objects.requireNonNull(right, operator + ": right operand cannot be null");

        if (!operator.acceptsOperands(left.getType(), right.getType())) {
            // EQUAL 没有固定的操作数类型，以左操作数为准
            Type expected = operator.getOperandType() != null ? operator.getOperandType() : left.getType();
            Type actual = left.getType() != expected ? left.getType() : right.getType();
            String where = operator + "(" + left + ", " + right + ")";
            logger.error("BinaryExpression-构造函数: {} 的操作数类型不合法: {} 和 {}", operator, left.getType(), right.getType());
            throw new TypeContractViolationException(expected, actual, where);
        }
        logger.debug("创建了一个 {}: {}", operator, this);
    }

    @Override
    public Expr evaluate(SymbolicStore store, int step) {
        Expr leftTerm = left.evaluate(store, step);
        Expr rightTerm = right.evaluate(store, step);
        return operator.apply(store.getCtx(), leftTerm, rightTerm);
    }

    @Override
    void collectVariableNames(Set<String> names) {
        left.collectVariableNames(names);
        right.collectVariableNames(names);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BinaryExpression that = (BinaryExpression) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
