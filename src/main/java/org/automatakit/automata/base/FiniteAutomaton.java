package org.automatakit.automata.base;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 有限自动机的统一查询接口，由显式自动机（DFA/NFA）和符号自动机共同实现。
 * 渲染器、模拟器等外部协作方只依赖此接口。
 *
 * @param <S> 状态类型
 * @param <I> 输入符号类型（显式自动机为符号，符号自动机为 {@code Valuation}）
 * @param <L> 迁移标签类型（显式自动机为符号，符号自动机为守卫）
 * @author Ayalyt
 */
public interface FiniteAutomaton<S, I, L> {

    /**
     * @return 状态集合的只读视图。
     */
    Set<S> getStates();

    /**
     * @return 初始状态集合。确定性自动机与本库中的非确定性自动机都只有一个初始状态。
     */
    Set<S> getInitialStates();

    /**
     * @return 接受状态集合的只读视图。
     */
    Set<S> getAcceptingStates();

    /**
     * 计算从给定状态读入一个输入符号后的后继状态集合。
     * @param state 源状态。
     * @param input 输入符号。
     * @return 后继状态集合，可能为空。
     * @throws org.automatakit.automata.exceptions.UnknownStateException 如果状态不属于自动机。
     * @throws org.automatakit.automata.exceptions.InvalidSymbolException 如果输入符号不合法。
     */
    Set<S> getSuccessors(S state, I input);

    /**
     * 获取从某状态出发的所有迁移。
     * @param state 源状态。
     * @return 迁移集合。
     * @throws org.automatakit.automata.exceptions.UnknownStateException 如果状态不属于自动机。
     */
    Set<Transition<S, L>> getTransitionsFrom(S state);

    /**
     * 检查自动机识别的语言是否为空。
     * @return 如果没有任何接受状态可达则返回 true。
     */
    boolean isEmpty();

    default boolean isAccepting(S state) {
        return getAcceptingStates().contains(state);
    }

    default int size() {
        return getStates().size();
    }

    /**
     * 从初始状态出发沿输入序列折叠 {@link #getSuccessors}，若最终到达任一接受状态则接受。
     * @param word 输入序列。
     * @return 如果自动机接受该序列则返回 true。
     */
    default boolean accepts(List<I> word) {
        Set<S> currentStates = getInitialStates();
        for (I symbol : word) {
            Set<S> nextStates = new HashSet<>();
            for (S state : currentStates) {
                nextStates.addAll(getSuccessors(state, symbol));
            }
            currentStates = nextStates;
            if (currentStates.isEmpty()) {
                return false;
            }
        }
        return currentStates.stream().anyMatch(this::isAccepting);
    }
}
