package org.automatakit.automata.explicit;

import org.apache.commons.lang3.tuple.Pair;
import org.automatakit.automata.base.Alphabet;
import org.automatakit.automata.base.Transition;
import org.automatakit.automata.fixpoint.Fixpoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 代表一个显式的确定性有限自动机 (DFA)，迁移函数为 state -> symbol -> state。
 * 迁移函数可以是部分的：未定义的 (state, symbol) 没有后继。
 * 此类是不可变的，complete / reachable / coreachable / trim / minimize 等变换都返回新实例。
 * @author Ayalyt
 */
public final class ExplicitDFA extends AbstractExplicitAutomaton {

    private static final Logger logger = LoggerFactory.getLogger(ExplicitDFA.class);

    private static final String EMPTY_STATE = "0";

    private final SortedMap<String, SortedMap<String, String>> transitionFunction;

    private final int hashCode;

    /**
     * 构造一个 DFA，并立即校验所有组件。
     *
     * @param states             状态集合。
     * @param alphabet           字母表。
     * @param initialState       初始状态。
     * @param acceptingStates    接受状态集合。
     * @param transitionFunction 迁移函数 (将被深拷贝)。
     * @throws org.automatakit.automata.exceptions.StructuralViolationException 如果任何结构约束不满足。
     */
    public ExplicitDFA(Set<String> states, Alphabet alphabet, String initialState, Set<String> acceptingStates,
                       Map<String, ? extends Map<String, String>> transitionFunction) {
        super(states, alphabet, initialState, acceptingStates);
        Objects.requireNonNull(transitionFunction, "Transition function cannot be null.");

        Set<String> referencedStates = new HashSet<>();
        Set<String> referencedSymbols = new HashSet<>();
        SortedMap<String, SortedMap<String, String>> tempFunction = new TreeMap<>();
        for (Map.Entry<String, ? extends Map<String, String>> entry : transitionFunction.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            referencedStates.add(entry.getKey());
            referencedStates.addAll(entry.getValue().values());
            referencedSymbols.addAll(entry.getValue().keySet());
            tempFunction.put(entry.getKey(), Collections.unmodifiableSortedMap(new TreeMap<>(entry.getValue())));
        }
        checkTransitionFunction(referencedStates, referencedSymbols);

        this.transitionFunction = Collections.unmodifiableSortedMap(tempFunction);
        this.hashCode = Objects.hash(getStates(), alphabet, initialState, getAcceptingStates(), this.transitionFunction);
        logger.debug("创建 ExplicitDFA：{} 个状态，{} 个符号。", getStates().size(), alphabet.size());
    }

    /**
     * 工厂方法：不显式给出状态集合与字母表，从迁移函数中推断它们。
     * 推断出的字母表按符号的自然顺序排列。
     *
     * @param initialState       初始状态。
     * @param acceptingStates    接受状态集合。
     * @param transitionFunction 迁移函数。
     * @return DFA 实例。
     */
    public static ExplicitDFA fromTransitions(String initialState, Set<String> acceptingStates,
                                              Map<String, ? extends Map<String, String>> transitionFunction) {
        Set<String> states = new TreeSet<>();
        Set<String> symbols = new TreeSet<>();
        for (Map.Entry<String, ? extends Map<String, String>> entry : transitionFunction.entrySet()) {
            states.add(entry.getKey());
            states.addAll(entry.getValue().values());
            symbols.addAll(entry.getValue().keySet());
        }
        return new ExplicitDFA(states, Alphabet.of(symbols), initialState, acceptingStates, transitionFunction);
    }

    /**
     * 工厂方法：空语言自动机，只有一个非接受状态且没有迁移。
     * @param alphabet 字母表。
     * @return 空 DFA。
     */
    public static ExplicitDFA empty(Alphabet alphabet) {
        return new ExplicitDFA(Set.of(EMPTY_STATE), alphabet, EMPTY_STATE, Set.of(), Map.of());
    }

    /**
     * @return 迁移函数的只读视图。
     */
    public Map<String, Map<String, String>> getTransitionFunction() {
        return Collections.unmodifiableMap(transitionFunction);
    }

    /**
     * 获取 (state, symbol) 的唯一后继。
     * @param state  源状态。
     * @param symbol 符号。
     * @return 后继状态；如果迁移未定义则返回 null。
     */
    public String getSuccessor(String state, String symbol) {
        checkState(state);
        checkSymbol(symbol);
        return transitionFunction.getOrDefault(state, Collections.emptySortedMap()).get(symbol);
    }

    @Override
    public Set<String> getSuccessors(String state, String symbol) {
        String successor = getSuccessor(state, symbol);
        return successor == null ? Set.of() : Set.of(successor);
    }

    @Override
    public Set<Transition<String, String>> getTransitionsFrom(String state) {
        checkState(state);
        return transitionFunction.getOrDefault(state, Collections.emptySortedMap()).entrySet().stream()
                .map(e -> new Transition<>(state, e.getKey(), e.getValue()))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * @return 如果每个 (state, symbol) 都有定义的后继则返回 true。
     */
    public boolean isComplete() {
        long definedTransitions = transitionFunction.values().stream().mapToLong(Map::size).sum();
        return definedTransitions == (long) getStates().size() * getAlphabet().size();
    }

    /**
     * 补全 DFA：为每个缺失的 (state, symbol) 添加指向新 sink 状态的迁移，sink 对每个符号都有自环。
     * @return 如果已经完全则返回自身，否则返回新的完全 DFA。
     */
    public ExplicitDFA complete() {
        if (isComplete()) {
            logger.debug("DFA 已经是完全的，complete 直接返回自身。");
            return this;
        }
        String sinkState = generateSinkName(getStates());
        Map<String, Map<String, String>> newFunction = copyTransitionFunction();
        for (String state : getStates()) {
            Map<String, String> row = newFunction.computeIfAbsent(state, k -> new TreeMap<>());
            for (String symbol : getAlphabet()) {
                row.putIfAbsent(symbol, sinkState);
            }
        }
        Map<String, String> sinkRow = new TreeMap<>();
        for (String symbol : getAlphabet()) {
            sinkRow.put(symbol, sinkState);
        }
        newFunction.put(sinkState, sinkRow);

        Set<String> newStates = new TreeSet<>(getStates());
        newStates.add(sinkState);
        logger.info("补全 DFA：添加 sink 状态 {}。", sinkState);
        return new ExplicitDFA(newStates, getAlphabet(), getInitialState(), getAcceptingStates(), newFunction);
    }

    /**
     * @return 只保留从初始状态可达的状态的等价 DFA。
     */
    public ExplicitDFA reachable() {
        Set<String> reachableStates = Fixpoints.leastFixpointOverStates(Set.of(getInitialState()), current -> {
            Set<String> result = new HashSet<>();
            for (String state : current) {
                result.addAll(transitionFunction.getOrDefault(state, Collections.emptySortedMap()).values());
            }
            return result;
        });
        logger.info("可达状态：{} / {}。", reachableStates.size(), getStates().size());
        return restrictTo(reachableStates);
    }

    /**
     * @return 只保留余可达状态（能到达某个接受状态）的等价 DFA；
     * 如果初始状态不是余可达的，返回空语言自动机。
     */
    public ExplicitDFA coreachable() {
        Set<String> coreachableStates = Fixpoints.leastFixpointOverStates(getAcceptingStates(), current -> {
            Set<String> result = new HashSet<>();
            for (Map.Entry<String, SortedMap<String, String>> entry : transitionFunction.entrySet()) {
                if (entry.getValue().values().stream().anyMatch(current::contains)) {
                    result.add(entry.getKey());
                }
            }
            return result;
        });
        logger.info("余可达状态：{} / {}。", coreachableStates.size(), getStates().size());
        if (!coreachableStates.contains(getInitialState())) {
            logger.info("初始状态不是余可达的，返回空语言自动机。");
            return empty(getAlphabet());
        }
        return restrictTo(coreachableStates);
    }

    /**
     * 修剪：先补全，再取可达部分，最后取余可达部分。
     * @return 修剪后的 DFA。
     */
    public ExplicitDFA trim() {
        return complete().reachable().coreachable();
    }

    /**
     * 基于互模拟的最小化。先补全，再用最大不动点求出最粗的等价关系，最后构造商自动机。
     * 每个等价类以其成员命名（形如 {a, b}）。
     * @return 最小且完全的 DFA。
     */
    public ExplicitDFA minimize() {
        ExplicitDFA dfa = complete();
        logger.info("开始最小化 DFA，共 {} 个状态。", dfa.getStates().size());

        Set<Pair<String, String>> seed = new HashSet<>();
        for (String s : dfa.getStates()) {
            for (String t : dfa.getStates()) {
                if (dfa.isAccepting(s) == dfa.isAccepting(t)) {
                    seed.add(Pair.of(s, t));
                }
            }
        }

        Set<Pair<String, String>> bisimulation = Fixpoints.greatestFixpointOverStatePairs(seed,
                (pair, relation) -> dfa.distinguishes(pair.getLeft(), pair.getRight(), relation));

        Map<String, Set<String>> stateToClass = new HashMap<>();
        for (Pair<String, String> pair : bisimulation) {
            stateToClass.computeIfAbsent(pair.getLeft(), k -> new TreeSet<>()).add(pair.getRight());
        }
        Map<Set<String>, String> classNames = new HashMap<>();
        Set<String> usedNames = new HashSet<>();
        Map<String, String> stateToClassName = new HashMap<>();
        for (String state : dfa.getStates()) {
            Set<String> members = stateToClass.get(state);
            stateToClassName.put(state, classNames.computeIfAbsent(members, m -> macroStateName(m, usedNames)));
        }

        Map<String, Map<String, String>> newFunction = new TreeMap<>();
        for (Map.Entry<String, SortedMap<String, String>> entry : dfa.transitionFunction.entrySet()) {
            Map<String, String> row = newFunction.computeIfAbsent(stateToClassName.get(entry.getKey()), k -> new TreeMap<>());
            entry.getValue().forEach((symbol, target) -> row.put(symbol, stateToClassName.get(target)));
        }
        Set<String> newStates = new TreeSet<>(stateToClassName.values());
        Set<String> newAcceptingStates = dfa.getAcceptingStates().stream()
                .map(stateToClassName::get)
                .collect(Collectors.toCollection(TreeSet::new));

        logger.info("最小化完成：{} 个状态合并为 {} 个等价类。", dfa.getStates().size(), newStates.size());
        return new ExplicitDFA(newStates, getAlphabet(), stateToClassName.get(getInitialState()),
                newAcceptingStates, newFunction);
    }

    /**
     * 判断状态对 (s, t) 是否能被某个符号区分：存在符号使得一方的后继未定义，或两个后继不在当前关系中。
     */
    private boolean distinguishes(String s, String t, Set<Pair<String, String>> relation) {
        Map<String, String> sRow = transitionFunction.getOrDefault(s, Collections.emptySortedMap());
        Map<String, String> tRow = transitionFunction.getOrDefault(t, Collections.emptySortedMap());
        for (String symbol : getAlphabet()) {
            String sNext = sRow.get(symbol);
            String tNext = tRow.get(symbol);
            if (sNext == null && tNext == null) {
                continue;
            }
            if (sNext == null || tNext == null || !relation.contains(Pair.of(sNext, tNext))) {
                return true;
            }
        }
        return false;
    }

    /**
     * 计算每个状态到达接受状态所需的最少步数；无法到达接受状态的状态记为 -1。
     * @return 状态到层级的映射。
     */
    public Map<String, Integer> levelsToAcceptingStates() {
        Map<String, Integer> levels = new TreeMap<>();
        Set<String> current = new HashSet<>(getAcceptingStates());
        getAcceptingStates().forEach(state -> levels.put(state, 0));
        int level = 0;
        boolean changed = true;
        while (changed) {
            level++;
            Set<String> next = new HashSet<>(current);
            for (Map.Entry<String, SortedMap<String, String>> entry : transitionFunction.entrySet()) {
                String state = entry.getKey();
                if (current.contains(state)) {
                    continue;
                }
                if (entry.getValue().values().stream().anyMatch(current::contains)) {
                    next.add(state);
                    levels.put(state, level);
                }
            }
            changed = next.size() != current.size();
            current = next;
        }
        for (String state : getStates()) {
            levels.putIfAbsent(state, -1);
        }
        return levels;
    }

    /**
     * 从初始状态出发做广度优先遍历（按符号的自然顺序），把状态依次重新编号为 "0", "1", ...
     * 不可达的状态被丢弃。
     * @return 重新编号后的 DFA。
     */
    public ExplicitDFA renumbering() {
        Map<String, String> oldToNew = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(getInitialState());
        oldToNew.put(getInitialState(), "0");
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : transitionFunction.getOrDefault(current, Collections.emptySortedMap()).values()) {
                if (!oldToNew.containsKey(next)) {
                    oldToNew.put(next, String.valueOf(oldToNew.size()));
                    queue.add(next);
                }
            }
        }

        Map<String, Map<String, String>> newFunction = new TreeMap<>();
        for (Map.Entry<String, String> entry : oldToNew.entrySet()) {
            Map<String, String> row = new TreeMap<>();
            transitionFunction.getOrDefault(entry.getKey(), Collections.emptySortedMap())
                    .forEach((symbol, target) -> row.put(symbol, oldToNew.get(target)));
            newFunction.put(entry.getValue(), row);
        }
        Set<String> newAcceptingStates = getAcceptingStates().stream()
                .filter(oldToNew::containsKey)
                .map(oldToNew::get)
                .collect(Collectors.toSet());
        return new ExplicitDFA(new HashSet<>(oldToNew.values()), getAlphabet(), "0", newAcceptingStates, newFunction);
    }

    @Override
    public boolean isEmpty() {
        return reachable().getAcceptingStates().isEmpty();
    }

    private ExplicitDFA restrictTo(Set<String> keptStates) {
        Map<String, Map<String, String>> newFunction = new TreeMap<>();
        for (String state : keptStates) {
            Map<String, String> row = new TreeMap<>();
            transitionFunction.getOrDefault(state, Collections.emptySortedMap()).forEach((symbol, target) -> {
                if (keptStates.contains(target)) {
                    row.put(symbol, target);
                }
            });
            newFunction.put(state, row);
        }
        Set<String> newAcceptingStates = new TreeSet<>(getAcceptingStates());
        newAcceptingStates.retainAll(keptStates);
        return new ExplicitDFA(keptStates, getAlphabet(), getInitialState(), newAcceptingStates, newFunction);
    }

    private Map<String, Map<String, String>> copyTransitionFunction() {
        Map<String, Map<String, String>> copy = new TreeMap<>();
        transitionFunction.forEach((state, row) -> copy.put(state, new TreeMap<>(row)));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExplicitDFA that = (ExplicitDFA) o;
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
        List<String> rows = new ArrayList<>();
        transitionFunction.forEach((state, row) ->
                row.forEach((symbol, target) -> rows.add(state + " --" + symbol + "--> " + target)));
        return "ExplicitDFA(initial=" + getInitialState() + ", accepting=" + getAcceptingStates() +
                ", transitions=" + rows + ")";
    }
}
