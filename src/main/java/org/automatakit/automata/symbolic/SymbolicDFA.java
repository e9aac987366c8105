package org.automatakit.automata.symbolic;

import org.automatakit.automata.exceptions.NonDeterminismException;
import org.automatakit.expressions.Guard;
import org.automatakit.symbolic.BooleanAlgebra;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * 确定性符号自动机：对任一源状态，指向不同目标的两条出边守卫的合取必须不可满足。
 * 该不变式在每次 {@link #addTransition(int, Guard, int)} 时检查，违反时拒绝修改。
 * @author Ayalyt
 */
public class SymbolicDFA extends SymbolicAutomaton {

    private static final Logger logger = LoggerFactory.getLogger(SymbolicDFA.class);

    public SymbolicDFA(BooleanAlgebra algebra) {
        super(algebra);
    }

    private SymbolicDFA(BooleanAlgebra algebra, boolean knownDeterministic) {
        super(algebra, knownDeterministic);
    }

    @Override
    SymbolicAutomaton newEmptyInstance() {
        return new SymbolicDFA(getAlgebra(), true);
    }

    /**
     * 添加迁移前检查 guard AND OR(其他目标上的出边守卫) 是否可满足。
     * @throws NonDeterminismException 如果新守卫与通向其他目标的守卫重叠。
     * @throws org.automatakit.automata.exceptions.UnknownStateException 如果任一端点不存在。
     */
    @Override
    public void addTransition(int source, Guard guard, int destination) {
        checkState(source);
        checkState(destination);
        BooleanAlgebra algebra = getAlgebra();
        List<Guard> otherGuards = new ArrayList<>();
        for (Map.Entry<Integer, Guard> entry : outgoing(source).entrySet()) {
            if (entry.getKey() != destination) {
                otherGuards.add(entry.getValue());
            }
        }
        if (algebra.isSatisfiable(algebra.and(guard, algebra.or(otherGuards)))) {
            logger.error("迁移 {} --[{}]--> {} 与状态 {} 的其他出边 {} 重叠。", source, guard, destination, source, otherGuards);
            throw new NonDeterminismException("守卫 " + guard + " 与状态 " + source + " 通向其他状态的守卫重叠。");
        }
        super.addTransition(source, guard, destination);
    }

    /**
     * @return 唯一的后继状态；没有后继时为空。
     */
    public OptionalInt getSuccessor(int state, Valuation valuation) {
        Set<Integer> successors = getSuccessors(state, valuation);
        if (successors.size() > 1) {
            // addTransition 保证不会发生
            logger.error("确定性自动机的状态 {} 有多个后继 {}。", state, successors);
            throw new IllegalStateException("确定性自动机的状态 " + state + " 有多个后继：" + successors);
        }
        return successors.isEmpty() ? OptionalInt.empty() : OptionalInt.of(successors.iterator().next());
    }

    @Override
    public boolean isDeterministic() {
        return true;
    }

    @Override
    public SymbolicDFA complete() {
        return (SymbolicDFA) super.complete();
    }

    @Override
    public SymbolicDFA determinize() {
        return (SymbolicDFA) super.determinize();
    }

    @Override
    public SymbolicDFA minimize() {
        return (SymbolicDFA) super.minimize();
    }
}
