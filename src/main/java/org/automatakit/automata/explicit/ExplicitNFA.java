package org.automatakit.automata.explicit;

import org.automatakit.automata.base.Alphabet;
import org.automatakit.automata.base.Transition;
import org.automatakit.automata.fixpoint.Fixpoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 代表一个显式的非确定性有限自动机 (NFA)，迁移函数为 state -> symbol -> set(state)。
 * 只有一个初始状态。此类是不可变的。
 * @author Ayalyt
 */
public final class ExplicitNFA extends AbstractExplicitAutomaton {

    private static final Logger logger = LoggerFactory.getLogger(ExplicitNFA.class);

    private final SortedMap<String, SortedMap<String, SortedSet<String>>> transitionFunction;

    private final int hashCode;

    /**
     * 构造一个 NFA，并立即校验所有组件。
     *
     * @param states             状态集合。
     * @param alphabet           字母表。
     * @param initialState       初始状态。
     * @param acceptingStates    接受状态集合。
     * @param transitionFunction 非确定性迁移函数 (将被深拷贝)。
     * @throws org.automatakit.automata.exceptions.StructuralViolationException 如果任何结构约束不满足。
     */
    public ExplicitNFA(Set<String> states, Alphabet alphabet, String initialState, Set<String> acceptingStates,
                       Map<String, ? extends Map<String, ? extends Set<String>>> transitionFunction) {
        super(states, alphabet, initialState, acceptingStates);
        Objects.requireNonNull(transitionFunction, "Transition function cannot be null.");

        Set<String> referencedStates = new HashSet<>();
        Set<String> referencedSymbols = new HashSet<>();
        SortedMap<String, SortedMap<String, SortedSet<String>>> tempFunction = new TreeMap<>();
        for (Map.Entry<String, ? extends Map<String, ? extends Set<String>>> entry : transitionFunction.entrySet()) {
            SortedMap<String, SortedSet<String>> row = new TreeMap<>();
            entry.getValue().forEach((symbol, targets) -> {
                if (!targets.isEmpty()) {
                    row.put(symbol, Collections.unmodifiableSortedSet(new TreeSet<>(targets)));
                    referencedSymbols.add(symbol);
                    referencedStates.addAll(targets);
                }
            });
            if (!row.isEmpty()) {
                referencedStates.add(entry.getKey());
                tempFunction.put(entry.getKey(), Collections.unmodifiableSortedMap(row));
            }
        }
        checkTransitionFunction(referencedStates, referencedSymbols);

        this.transitionFunction = Collections.unmodifiableSortedMap(tempFunction);
        this.hashCode = Objects.hash(getStates(), alphabet, initialState, getAcceptingStates(), this.transitionFunction);
        logger.debug("创建 ExplicitNFA：{} 个状态，{} 个符号。", getStates().size(), alphabet.size());
    }

    /**
     * 工厂方法：从非确定性迁移函数中推断状态集合与字母表（按自然顺序）。
     *
     * @param initialState       初始状态。
     * @param acceptingStates    接受状态集合。
     * @param transitionFunction 非确定性迁移函数。
     * @return NFA 实例。
     */
    public static ExplicitNFA fromTransitions(String initialState, Set<String> acceptingStates,
                                              Map<String, ? extends Map<String, ? extends Set<String>>> transitionFunction) {
        Set<String> states = new TreeSet<>();
        Set<String> symbols = new TreeSet<>();
        for (Map.Entry<String, ? extends Map<String, ? extends Set<String>>> entry : transitionFunction.entrySet()) {
            states.add(entry.getKey());
            entry.getValue().forEach((symbol, targets) -> {
                states.addAll(targets);
                symbols.add(symbol);
            });
        }
        return new ExplicitNFA(states, Alphabet.of(symbols), initialState, acceptingStates, transitionFunction);
    }

    /**
     * @return 迁移函数的只读视图。
     */
    public Map<String, Map<String, SortedSet<String>>> getTransitionFunction() {
        return Collections.unmodifiableMap(transitionFunction);
    }

    @Override
    public Set<String> getSuccessors(String state, String symbol) {
        checkState(state);
        checkSymbol(symbol);
        return transitionFunction.getOrDefault(state, Collections.emptySortedMap())
                .getOrDefault(symbol, Collections.emptySortedSet());
    }

    @Override
    public Set<Transition<String, String>> getTransitionsFrom(String state) {
        checkState(state);
        Set<Transition<String, String>> transitions = new LinkedHashSet<>();
        transitionFunction.getOrDefault(state, Collections.emptySortedMap()).forEach((symbol, targets) -> {
            for (String target : targets) {
                transitions.add(new Transition<>(state, symbol, target));
            }
        });
        return transitions;
    }

    /**
     * 子集构造：从 {初始状态} 出发，只生成可达的宏状态。
     * 宏状态与原接受状态相交时为接受状态；后继宏状态为空时不定义迁移，因此结果可能是部分 DFA。
     * @return 等价的 DFA，宏状态以其成员命名（形如 {q0, q1}）。
     */
    public ExplicitDFA determinize() {
        logger.info("开始对 NFA 做子集构造，原 NFA 共 {} 个状态。", getStates().size());
        SortedSet<String> initialMacroState = new TreeSet<>(Set.of(getInitialState()));
        Map<SortedSet<String>, String> macroStateNames = new HashMap<>();
        Set<String> usedNames = new HashSet<>();
        macroStateNames.put(initialMacroState, macroStateName(initialMacroState, usedNames));
        Deque<SortedSet<String>> stack = new ArrayDeque<>();
        stack.push(initialMacroState);

        Map<String, Map<String, String>> newFunction = new TreeMap<>();
        Set<String> newAcceptingStates = new TreeSet<>();
        while (!stack.isEmpty()) {
            SortedSet<String> macroSource = stack.pop();
            String sourceName = macroStateNames.get(macroSource);
            if (macroSource.stream().anyMatch(this::isAccepting)) {
                newAcceptingStates.add(sourceName);
            }
            for (String symbol : getAlphabet()) {
                SortedSet<String> macroTarget = new TreeSet<>();
                for (String member : macroSource) {
                    macroTarget.addAll(transitionFunction.getOrDefault(member, Collections.emptySortedMap())
                            .getOrDefault(symbol, Collections.emptySortedSet()));
                }
                if (macroTarget.isEmpty()) {
                    continue;
                }
                String targetName = macroStateNames.get(macroTarget);
                if (targetName == null) {
                    targetName = macroStateName(macroTarget, usedNames);
                    macroStateNames.put(macroTarget, targetName);
                    stack.push(macroTarget);
                }
                newFunction.computeIfAbsent(sourceName, k -> new TreeMap<>()).put(symbol, targetName);
            }
        }

        logger.info("子集构造完成，共生成 {} 个宏状态。", macroStateNames.size());
        return new ExplicitDFA(new HashSet<>(macroStateNames.values()), getAlphabet(),
                macroStateNames.get(initialMacroState), newAcceptingStates, newFunction);
    }

    @Override
    public boolean isEmpty() {
        Set<String> reachableStates = Fixpoints.leastFixpointOverStates(Set.of(getInitialState()), current -> {
            Set<String> result = new HashSet<>();
            for (String state : current) {
                transitionFunction.getOrDefault(state, Collections.emptySortedMap()).values().forEach(result::addAll);
            }
            return result;
        });
        return reachableStates.stream().noneMatch(this::isAccepting);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExplicitNFA that = (ExplicitNFA) o;
        return getStates().equals(that.getStates()) &&
                getAlphabet().equals(that.getAlphabet()) &&
                getInitialState().equals(that.getInitialState()) &&
                getAcceptingStates().equals(that.getAcceptingStates()) &&
                transitionFunction.equals(that.transitionFunction);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "ExplicitNFA(initial=" + getInitialState() + ", accepting=" + getAcceptingStates() +
                ", transitions=" + transitionFunction + ")";
    }
}
