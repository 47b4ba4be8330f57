package org.symir.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.symir.core.Type;
import org.symir.exceptions.StepIndexOutOfRangeException;
import org.symir.exceptions.TypeContractViolationException;
import org.symir.exceptions.UnboundVariableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 符号存储：从变量名到按步骤下标排列的 Z3 符号项序列的映射。
 * 表达式求值只读取它；新的快照只能通过 {@link #nextStep()} 等方法产生，
 * 原快照保持不变 (每条路径只追加，分支时复制)。
 * 因为构造后不再修改，同一个实例可以被多个线程同时读取。
 * Z3 Context 由调用者创建并负责关闭。
 * @author Ayalyt
 */
@Getter
public final class SymbolicStore {

    private static final Logger logger = LoggerFactory.getLogger(SymbolicStore.class);

    private final Context ctx;
    // 每个变量的序列都是不可修改的，第 k 个元素就是该变量在第 k 步的符号项
    private final SortedMap<String, List<ArithExpr>> terms;

    private SymbolicStore(Context ctx, Map<String, ? extends List<? extends ArithExpr>> terms) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        Objects.requireNonNull(terms, "Terms map cannot be null.");
        SortedMap<String, List<ArithExpr>> copy = new TreeMap<>();
        terms.forEach((name, sequence) -> {
            List<ArithExpr> checked = List.copyOf(Objects.requireNonNull(sequence, "Term sequence cannot be null."));
            for (int step = 0; step < checked.size(); step++) {
                ArithExpr term = checked.get(step);
                if (!Type.NAT.accepts(term)) {
                    logger.error("SymbolicStore-构造函数: 变量 '{}' 第 {} 步的项 {} 不是整数项，排序为 {}",
                            name, step, term, term.getSort());
                    throw new TypeContractViolationException(Type.NAT, term.getSort().toString(),
                            "SymbolicStore(" + name + "@" + step + ")");
                }
            }
            copy.put(Objects.requireNonNull(name, "Variable name cannot be null."), checked);
        });
        this.terms = Collections.unmodifiableSortedMap(copy);
        logger.debug("创建 SymbolicStore: {} 个变量，深度 {}", this.terms.size(), getDepth());
    }

    /**
     * 为给定的变量创建第 0 步的存储，每个变量对应一个新的 Int 常量 {@code name@0}。
     * @param ctx Z3 Context 实例。
     * @param names 变量名集合。
     * @return 深度为 1 的存储。
     */
    public static SymbolicStore initial(Context ctx, Collection<String> names) {
        Map<String, List<ArithExpr>> initialTerms = new TreeMap<>();
        for (String name : names) {
            initialTerms.put(name, List.of(stepConstant(ctx, name, 0)));
        }
        logger.info("初始化 SymbolicStore，变量: {}", initialTerms.keySet());
        return new SymbolicStore(ctx, initialTerms);
    }

    /**
     * 包装外部已经构造好的符号项序列。
     * @param ctx 构造这些符号项所用的 Z3 Context。
     * @param terms 变量名到符号项序列的映射。
     */
    public static SymbolicStore of(Context ctx, Map<String, ? extends List<? extends ArithExpr>> terms) {
        return new SymbolicStore(ctx, terms);
    }

    /**
     * 为每个变量追加一个新的符号常量，得到下一步的快照。
     * @return 新的快照，当前实例不变。
     */
    public SymbolicStore nextStep() {
        return nextStep(Collections.emptyMap());
    }

    /**
     * 追加下一步的符号项：在 {@code bindings} 中给出的变量使用给定的项，其余变量使用新的符号常量。
     * @param bindings 变量名到下一步符号项的映射。
     * @return 新的快照，当前实例不变。
     * @throws UnboundVariableException 如果 bindings 中含有存储中不存在的变量。
     */
    public SymbolicStore nextStep(Map<String, ? extends ArithExpr> bindings) {
        for (String name : bindings.keySet()) {
            if (!terms.containsKey(name)) {
                logger.error("nextStep: 绑定了不存在的变量 '{}'", name);
                throw new UnboundVariableException(name);
            }
        }
        Map<String, List<ArithExpr>> extended = new TreeMap<>();
        terms.forEach((name, sequence) -> {
            List<ArithExpr> next = new ArrayList<>(sequence);
            ArithExpr bound = bindings.get(name);
            next.add(bound != null ? bound : stepConstant(ctx, name, sequence.size()));
            extended.put(name, next);
        });
        logger.debug("SymbolicStore 前进一步，绑定: {}", bindings.keySet());
        return new SymbolicStore(ctx, extended);
    }

    /**
     * 读取变量在指定步骤的符号项。
     * @param name 变量名。
     * @param step 步骤下标。
     * @return 对应的 Z3 整数项。
     * @throws UnboundVariableException 如果变量不存在。
     * @throws StepIndexOutOfRangeException 如果步骤下标不在已填充范围内。
     */
    public ArithExpr lookup(String name, int step) {
        List<ArithExpr> sequence = terms.get(name);
        if (sequence == null) {
            logger.error("lookup: 变量 '{}' 不存在于存储 {} 中", name, terms.keySet());
            throw new UnboundVariableException(name);
        }
        if (step < 0 || step >= sequence.size()) {
            logger.error("lookup: 变量 '{}' 的步骤 {} 越界 (深度 {})", name, step, sequence.size());
            throw new StepIndexOutOfRangeException(name, step, sequence.size());
        }
        return sequence.get(step);
    }

    public boolean contains(String name) {
        return terms.containsKey(name);
    }

    public Set<String> getVariableNames() {
        return terms.keySet();
    }

    /**
     * 所有变量共同已填充的步数，即各序列长度的最小值。空存储的深度为 0。
     */
    public int getDepth() {
        return terms.values().stream().mapToInt(List::size).min().orElse(0);
    }

    private static ArithExpr stepConstant(Context ctx, String name, int step) {
        return (ArithExpr) ctx.mkConst(name + "@" + step, Type.NAT.toZ3Sort(ctx));
    }

    @Override
    public String toString() {
        return "SymbolicStore" + terms;
    }
}
