package org.automatakit.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 守卫的工厂方法。构造时做纯结构上的化简：
 * 常量传播、双重否定消去、同类运算展平、去重、互补文字检测，并按文本排序操作数，
 * 使得结构相同的公式得到相等的对象。语义上的化简由 {@link org.automatakit.symbolic.BooleanAlgebra#simplify} 完成。
 * @author Ayalyt
 */
public final class Guards {

    private static final Logger logger = LoggerFactory.getLogger(Guards.class);

    public static final ConstantGuard TRUE = new ConstantGuard(true);
    public static final ConstantGuard FALSE = new ConstantGuard(false);

    private static final Comparator<Guard> OPERAND_ORDER =
            Comparator.comparing(Guard::toString).thenComparing(g -> g.getClass().getSimpleName());

    private Guards() {
    }

    public static Guard constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Guard proposition(String name) {
        if (name == null || name.isBlank()) {
            logger.error("命题名 '{}' 为空。", name);
            throw new IllegalArgumentException("Proposition name cannot be null or blank.");
        }
        return new PropositionGuard(name);
    }

    public static Guard not(Guard guard) {
        Objects.requireNonNull(guard, "Guard cannot be null.");
        if (guard instanceof ConstantGuard) {
            return constant(!((ConstantGuard) guard).getValue());
        }
        if (guard instanceof NotGuard) {
            return ((NotGuard) guard).getOperand();
        }
        return new NotGuard(guard);
    }

    public static Guard and(Guard... guards) {
        return and(Arrays.asList(guards));
    }

    public static Guard and(Collection<? extends Guard> guards) {
        return junction(guards, true);
    }

    public static Guard or(Guard... guards) {
        return or(Arrays.asList(guards));
    }

    public static Guard or(Collection<? extends Guard> guards) {
        return junction(guards, false);
    }

    public static Guard implies(Guard premise, Guard conclusion) {
        return or(not(premise), conclusion);
    }

    public static Guard iff(Guard left, Guard right) {
        return or(and(left, right), and(not(left), not(right)));
    }

    public static Guard xor(Guard left, Guard right) {
        return or(and(left, not(right)), and(not(left), right));
    }

    /**
     * 合取 (conjunction = true) 或析取 (conjunction = false) 的统一构造。
     * 对合取而言 TRUE 是单位元、FALSE 是零元；析取相反。
     */
    private static Guard junction(Collection<? extends Guard> guards, boolean conjunction) {
        Objects.requireNonNull(guards, "Guards cannot be null.");
        ConstantGuard identity = conjunction ? TRUE : FALSE;
        ConstantGuard absorbing = conjunction ? FALSE : TRUE;

        Set<Guard> flattened = new LinkedHashSet<>();
        for (Guard guard : guards) {
            Objects.requireNonNull(guard, "Guard cannot be null.");
            if (guard.equals(absorbing)) {
                return absorbing;
            }
            if (guard.equals(identity)) {
                continue;
            }
            if (conjunction ? guard instanceof AndGuard : guard instanceof OrGuard) {
                flattened.addAll(((JunctionGuard) guard).getOperands());
            } else {
                flattened.add(guard);
            }
        }
        for (Guard guard : flattened) {
            if (flattened.contains(not(guard))) {
                return absorbing;
            }
        }
        if (flattened.isEmpty()) {
            return identity;
        }
        if (flattened.size() == 1) {
            return flattened.iterator().next();
        }
        List<Guard> operands = new ArrayList<>(flattened);
        operands.sort(OPERAND_ORDER);
        return conjunction ? new AndGuard(operands) : new OrGuard(operands);
    }
}
