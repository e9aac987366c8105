package org.automatakit.automata.symbolic;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.automatakit.automata.base.FiniteAutomaton;
import org.automatakit.automata.base.Transition;
import org.automatakit.automata.exceptions.IllegalMutationException;
import org.automatakit.automata.exceptions.InvalidSymbolException;
import org.automatakit.automata.exceptions.UnknownStateException;
import org.automatakit.automata.fixpoint.Fixpoints;
import org.automatakit.expressions.Guard;
import org.automatakit.symbolic.BooleanAlgebra;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
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
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 符号自动机：迁移标签是命名命题上的布尔守卫，输入符号是 {@link Valuation}。
 * <p>
 * 这是一个可变的构建器。状态是由单调递增计数器分配的整数，删除后编号不会被回收。
 * 每个有序状态对 (source, destination) 上至多有一个守卫，重复添加时取析取。
 * determinize / minimize / complete 不修改接收者，而是返回新的自动机。
 * 所有守卫推理都委托给注入的 {@link BooleanAlgebra}。此类不是线程安全的。
 * @author Ayalyt
 */
public class SymbolicAutomaton implements FiniteAutomaton<Integer, Valuation, Guard> {

    private static final Logger logger = LoggerFactory.getLogger(SymbolicAutomaton.class);

    @Getter
    private final BooleanAlgebra algebra;
    private final SortedSet<Integer> states;
    private final SortedSet<Integer> acceptingStates;
    private final SortedMap<Integer, SortedMap<Integer, Guard>> transitionFunction;
    @Getter
    private int initialState;
    private int stateCounter;
    /** 由算法产生的结果已知是确定性的；任何修改都会清除这个标记。 */
    private boolean knownDeterministic;

    /**
     * 创建只含一个状态 (0) 的符号自动机，该状态为初始状态、非接受状态。
     * @param algebra 用于守卫推理的布尔代数。
     */
    public SymbolicAutomaton(BooleanAlgebra algebra) {
        this(algebra, false);
        createState();
        this.initialState = 0;
    }

    /**
     * 创建不含任何状态的实例，只供复制与重编号使用。
     */
    SymbolicAutomaton(BooleanAlgebra algebra, boolean knownDeterministic) {
        this.algebra = Objects.requireNonNull(algebra, "Boolean algebra cannot be null.");
        this.states = new TreeSet<>();
        this.acceptingStates = new TreeSet<>();
        this.transitionFunction = new TreeMap<>();
        this.initialState = 0;
        this.stateCounter = 0;
        this.knownDeterministic = knownDeterministic;
    }

    /**
     * 创建与当前实例同类型的空实例。子类通过覆盖此方法使算法结果保持其类型。
     */
    SymbolicAutomaton newEmptyInstance() {
        return new SymbolicAutomaton(algebra, false);
    }

    // ------------------------------------------------------------------
    // 构建
    // ------------------------------------------------------------------

    /**
     * 创建一个新状态。
     * @return 新状态的编号。
     */
    public int createState() {
        int newState = stateCounter++;
        states.add(newState);
        knownDeterministic = false;
        logger.debug("创建状态 {}。", newState);
        return newState;
    }

    /**
     * 删除一个状态及其所有入边和出边。
     * @param state 要删除的状态。
     * @throws UnknownStateException 如果状态不存在。
     * @throws IllegalMutationException 如果试图删除初始状态。
     */
    public void removeState(int state) {
        checkState(state);
        if (state == initialState) {
            logger.error("试图删除初始状态 {}。", state);
            throw new IllegalMutationException("不能删除初始状态 " + state + "。");
        }
        states.remove(state);
        acceptingStates.remove(state);
        transitionFunction.remove(state);
        transitionFunction.values().forEach(row -> row.remove(state));
        transitionFunction.values().removeIf(Map::isEmpty);
        knownDeterministic = false;
        logger.debug("删除状态 {}。", state);
    }

    /**
     * @throws UnknownStateException 如果状态不存在。
     */
    public void setInitialState(int state) {
        checkState(state);
        this.initialState = state;
        knownDeterministic = false;
    }

    /**
     * @throws UnknownStateException 如果状态不存在。
     */
    public void setAcceptingState(int state, boolean accepting) {
        checkState(state);
        if (accepting) {
            acceptingStates.add(state);
        } else {
            acceptingStates.remove(state);
        }
    }

    /**
     * 添加一条迁移。若 (source, destination) 上已有守卫，则替换为两者的析取。守卫在保存前会被化简。
     * @param source      源状态。
     * @param guard       守卫。
     * @param destination 目标状态。
     * @throws UnknownStateException 如果任一端点不存在。
     */
    public void addTransition(int source, Guard guard, int destination) {
        Objects.requireNonNull(guard, "Guard cannot be null.");
        checkState(source);
        checkState(destination);
        putGuard(source, guard, destination);
        knownDeterministic = false;
    }

    /**
     * 添加一条以文本表示守卫的迁移，文本由 {@link BooleanAlgebra#parse} 解析。
     * @throws org.automatakit.expressions.GuardParseException 如果文本不合法。
     */
    public void addTransition(int source, String guard, int destination) {
        Objects.requireNonNull(guard, "Guard cannot be null.");
        addTransition(source, algebra.parse(guard), destination);
    }

    /**
     * 不做任何检查地合并守卫。
     */
    final void putGuard(int source, Guard guard, int destination) {
        SortedMap<Integer, Guard> row = transitionFunction.computeIfAbsent(source, k -> new TreeMap<>());
        Guard existing = row.get(destination);
        Guard merged = existing == null ? guard : algebra.or(existing, guard);
        row.put(destination, algebra.simplify(merged));
        logger.debug("迁移 {} --[{}]--> {}", source, row.get(destination), destination);
    }

    // ------------------------------------------------------------------
    // 查询
    // ------------------------------------------------------------------

    @Override
    public Set<Integer> getStates() {
        return Collections.unmodifiableSortedSet(states);
    }

    @Override
    public Set<Integer> getInitialStates() {
        return Set.of(initialState);
    }

    @Override
    public Set<Integer> getAcceptingStates() {
        return Collections.unmodifiableSortedSet(acceptingStates);
    }

    /**
     * @return 迁移函数 source -&gt; destination -&gt; guard 的只读视图。
     */
    public Map<Integer, Map<Integer, Guard>> getTransitionFunction() {
        Map<Integer, Map<Integer, Guard>> view = new TreeMap<>();
        transitionFunction.forEach((source, row) -> view.put(source, Collections.unmodifiableMap(row)));
        return Collections.unmodifiableMap(view);
    }

    /**
     * 代入赋值后守卫为真的所有目标状态。赋值中缺失的命题视为 false。
     * @throws UnknownStateException 如果状态不存在。
     * @throws InvalidSymbolException 如果赋值为 null。
     */
    @Override
    public Set<Integer> getSuccessors(Integer state, Valuation valuation) {
        Objects.requireNonNull(state, "State cannot be null.");
        checkState(state);
        if (valuation == null) {
            logger.error("查询状态 {} 的后继时赋值为 null。", state);
            throw new InvalidSymbolException("赋值不能为 null。");
        }
        Set<Integer> successors = new TreeSet<>();
        outgoing(state).forEach((destination, guard) -> {
            Guard resolved = algebra.substitute(guard, valuation.getAssignment());
            if (resolved.evaluate(Map.of())) {
                successors.add(destination);
            }
        });
        return successors;
    }

    /**
     * 以原始 Map 表示赋值的便捷重载。
     * @throws InvalidSymbolException 如果映射不是合法的命题赋值。
     */
    public Set<Integer> getSuccessors(int state, Map<String, Boolean> valuation) {
        return getSuccessors(state, Valuation.of(valuation));
    }

    @Override
    public Set<Transition<Integer, Guard>> getTransitionsFrom(Integer state) {
        Objects.requireNonNull(state, "State cannot be null.");
        checkState(state);
        Set<Transition<Integer, Guard>> transitions = new LinkedHashSet<>();
        outgoing(state).forEach((destination, guard) -> transitions.add(new Transition<>(state, guard, destination)));
        return transitions;
    }

    /**
     * 完全性：对每个状态，出边守卫的析取是永真式（每个赋值至少触发一条出边）。
     */
    public boolean isComplete() {
        for (int state : states) {
            if (algebra.isSatisfiable(residualGuard(state))) {
                logger.debug("状态 {} 存在不触发任何出边的赋值。", state);
                return false;
            }
        }
        return true;
    }

    /**
     * 确定性：对每个状态，指向不同目标的任意两条出边守卫的合取不可满足。
     */
    public boolean isDeterministic() {
        if (knownDeterministic) {
            return true;
        }
        for (int state : states) {
            List<Map.Entry<Integer, Guard>> edges = new ArrayList<>(outgoing(state).entrySet());
            for (int i = 0; i < edges.size(); i++) {
                for (int j = i + 1; j < edges.size(); j++) {
                    if (algebra.isSatisfiable(algebra.and(edges.get(i).getValue(), edges.get(j).getValue()))) {
                        logger.debug("状态 {} 的出边 {} 与 {} 重叠。", state, edges.get(i), edges.get(j));
                        return false;
                    }
                }
            }
        }
        return true;
    }

    /**
     * 语言为空当且仅当沿可满足的守卫无法到达任何接受状态。
     */
    @Override
    public boolean isEmpty() {
        return reachableStates().stream().noneMatch(acceptingStates::contains);
    }

    // ------------------------------------------------------------------
    // 算法
    // ------------------------------------------------------------------

    /**
     * 补全：对每个状态，若出边守卫析取的否定可满足，则将其导向一个共享的 sink 状态。
     * sink 状态按需创建（编号来自计数器），并带有一个 TRUE 自环。
     * @return 完全的新自动机；若已完全，则返回内容相同的副本。
     */
    public SymbolicAutomaton complete() {
        SymbolicAutomaton result = copy();
        Integer sinkState = null;
        for (int state : states) {
            Guard residual = algebra.simplify(residualGuard(state));
            if (algebra.isSatisfiable(residual)) {
                if (sinkState == null) {
                    sinkState = result.createState();
                    logger.info("补全符号自动机：添加 sink 状态 {}。", sinkState);
                }
                result.putGuard(state, residual, sinkState);
            }
        }
        if (sinkState != null) {
            result.putGuard(sinkState, algebra.trueGuard(), sinkState);
        }
        result.knownDeterministic = knownDeterministic;
        return result;
    }

    /**
     * 符号子集构造。宏状态是原状态的集合，从 {初始状态} 出发；
     * 对每个宏状态 M，枚举其成员出边集合 T 的每个非空子集，
     * 候选守卫为 AND(T 中的守卫) AND AND(NOT 其余守卫)，可满足时产生一条通向 T 中目标并集的迁移。
     * 枚举过程中前缀不可满足的分支会被剪掉。
     * @return 确定性的新自动机，初始状态为 0；若已知确定性，则返回副本。
     */
    public SymbolicAutomaton determinize() {
        if (knownDeterministic) {
            logger.debug("自动机已知是确定性的，determinize 返回副本。");
            return copy();
        }
        logger.info("开始符号子集构造，原自动机共 {} 个状态。", states.size());
        SortedSet<Integer> initialMacroState = new TreeSet<>(Set.of(initialState));
        Set<SortedSet<Integer>> visited = new LinkedHashSet<>();
        visited.add(initialMacroState);
        Deque<SortedSet<Integer>> stack = new ArrayDeque<>();
        stack.push(initialMacroState);
        Map<SortedSet<Integer>, Map<SortedSet<Integer>, Guard>> moves = new HashMap<>();
        int satisfiableSubsets = 0;

        while (!stack.isEmpty()) {
            SortedSet<Integer> macroSource = stack.pop();
            List<Transition<Integer, Guard>> edges = new ArrayList<>();
            for (int member : macroSource) {
                outgoing(member).forEach((destination, guard) -> edges.add(new Transition<>(member, guard, destination)));
            }
            Map<SortedSet<Integer>, Guard> macroMoves = new LinkedHashMap<>();
            enumerateSubsets(edges, 0, algebra.trueGuard(), new TreeSet<>(), macroMoves);
            satisfiableSubsets += macroMoves.size();
            moves.put(macroSource, macroMoves);
            for (SortedSet<Integer> macroTarget : macroMoves.keySet()) {
                if (visited.add(macroTarget)) {
                    stack.push(macroTarget);
                }
            }
        }

        Set<SortedSet<Integer>> accepting = new HashSet<>();
        for (SortedSet<Integer> macroState : visited) {
            if (macroState.stream().anyMatch(acceptingStates::contains)) {
                accepting.add(macroState);
            }
        }
        List<Transition<SortedSet<Integer>, Guard>> transitions = new ArrayList<>();
        moves.forEach((source, row) -> row.forEach((target, guard) -> transitions.add(new Transition<>(source, guard, target))));

        logger.info("符号子集构造完成：{} 个宏状态，{} 条可满足的迁移。", visited.size(), satisfiableSubsets);
        return fromTransitions(visited, initialMacroState, accepting, transitions, true);
    }

    /**
     * 按出边逐个决定“包含 / 不包含”，相当于枚举幂集；当前合取不可满足时剪枝。
     * 目标并集相同的不同子集，其守卫取析取。
     */
    private void enumerateSubsets(List<Transition<Integer, Guard>> edges, int index, Guard phi,
                                  SortedSet<Integer> targets, Map<SortedSet<Integer>, Guard> result) {
        if (!algebra.isSatisfiable(phi)) {
            return;
        }
        if (index == edges.size()) {
            if (!targets.isEmpty()) {
                result.merge(new TreeSet<>(targets), phi, (a, b) -> algebra.or(a, b));
            }
            return;
        }
        Transition<Integer, Guard> edge = edges.get(index);
        SortedSet<Integer> withTarget = new TreeSet<>(targets);
        withTarget.add(edge.getTarget());
        enumerateSubsets(edges, index + 1, algebra.and(phi, edge.getLabel()), withTarget, result);
        enumerateSubsets(edges, index + 1, algebra.and(phi, algebra.not(edge.getLabel())), targets, result);
    }

    /**
     * 基于互模拟的最小化。先 determinize().complete()，只保留可达状态；
     * 初始关系为接受性相同的状态对，若存在出边 p --g1--&gt; d1 与 q --g2--&gt; d2，
     * 其中 d1 != d2、(d1, d2) 不在当前关系中且 g1 AND g2 可满足，则删除 (p, q)。
     * 等价类通过并集合并，落在同一对新状态上的守卫取析取。
     * @return 确定性、完全的最小自动机。
     */
    public SymbolicAutomaton minimize() {
        SymbolicAutomaton dfa = determinize().complete();
        Set<Integer> reachable = dfa.reachableStates();
        logger.info("开始最小化符号自动机，共 {} 个可达状态。", reachable.size());

        Set<Pair<Integer, Integer>> seed = new HashSet<>();
        for (int p : reachable) {
            for (int q : reachable) {
                if (dfa.isAccepting(p) == dfa.isAccepting(q)) {
                    seed.add(Pair.of(p, q));
                }
            }
        }
        Set<Pair<Integer, Integer>> bisimulation = Fixpoints.greatestFixpointOverStatePairs(seed,
                (pair, relation) -> dfa.distinguishes(pair.getLeft(), pair.getRight(), relation));

        Map<Integer, SortedSet<Integer>> stateToClass = new HashMap<>();
        for (int state : reachable) {
            stateToClass.put(state, new TreeSet<>(Set.of(state)));
        }
        for (Pair<Integer, Integer> pair : bisimulation) {
            SortedSet<Integer> left = stateToClass.get(pair.getLeft());
            SortedSet<Integer> right = stateToClass.get(pair.getRight());
            if (left != right) {
                left.addAll(right);
                for (int member : right) {
                    stateToClass.put(member, left);
                }
            }
        }

        Set<SortedSet<Integer>> classes = new LinkedHashSet<>();
        reachable.stream().sorted().forEach(state -> classes.add(stateToClass.get(state)));
        Set<SortedSet<Integer>> accepting = new HashSet<>();
        List<Transition<SortedSet<Integer>, Guard>> transitions = new ArrayList<>();
        for (int source : reachable) {
            if (dfa.isAccepting(source)) {
                accepting.add(stateToClass.get(source));
            }
            dfa.outgoing(source).forEach((destination, guard) ->
                    transitions.add(new Transition<>(stateToClass.get(source), guard, stateToClass.get(destination))));
        }

        logger.info("最小化完成：{} 个状态合并为 {} 个等价类。", reachable.size(), classes.size());
        return fromTransitions(classes, stateToClass.get(dfa.initialState), accepting, transitions, true);
    }

    /**
     * 两个方向都检查：(d1, d2) 与 (d2, d1) 任一不在关系中即视为可区分的后继。
     */
    private boolean distinguishes(int p, int q, Set<Pair<Integer, Integer>> relation) {
        for (Map.Entry<Integer, Guard> left : outgoing(p).entrySet()) {
            for (Map.Entry<Integer, Guard> right : outgoing(q).entrySet()) {
                int d1 = left.getKey();
                int d2 = right.getKey();
                if (d1 == d2) {
                    continue;
                }
                boolean related = relation.contains(Pair.of(d1, d2)) && relation.contains(Pair.of(d2, d1));
                if (!related && algebra.isSatisfiable(algebra.and(left.getValue(), right.getValue()))) {
                    return true;
                }
            }
        }
        return false;
    }

    // ------------------------------------------------------------------
    // 内部工具
    // ------------------------------------------------------------------

    /**
     * 沿可满足的守卫从初始状态可达的状态。
     */
    Set<Integer> reachableStates() {
        return Fixpoints.leastFixpointOverStates(Set.of(initialState), current -> {
            Set<Integer> result = new HashSet<>();
            for (int state : current) {
                outgoing(state).forEach((destination, guard) -> {
                    if (!result.contains(destination) && algebra.isSatisfiable(guard)) {
                        result.add(destination);
                    }
                });
            }
            return result;
        });
    }

    private Guard residualGuard(int state) {
        return algebra.not(algebra.or(outgoing(state).values()));
    }

    final Map<Integer, Guard> outgoing(int state) {
        return transitionFunction.getOrDefault(state, Collections.emptySortedMap());
    }

    final void checkState(int state) {
        if (!states.contains(state)) {
            logger.error("状态 {} 不存在于符号自动机中。", state);
            throw new UnknownStateException(state);
        }
    }

    /**
     * @return 状态编号、计数器与迁移都相同的副本，类型与接收者相同。
     */
    SymbolicAutomaton copy() {
        SymbolicAutomaton result = newEmptyInstance();
        result.states.addAll(states);
        result.acceptingStates.addAll(acceptingStates);
        transitionFunction.forEach((source, row) -> result.transitionFunction.put(source, new TreeMap<>(row)));
        result.initialState = initialState;
        result.stateCounter = stateCounter;
        result.knownDeterministic = knownDeterministic;
        return result;
    }

    /**
     * 从算法计算出的状态与迁移构造新自动机并重编号：初始状态为 0，其余按 states 的迭代顺序编号。
     * 落在同一对新状态上的守卫取析取。
     */
    <K> SymbolicAutomaton fromTransitions(Collection<K> newStates, K newInitialState, Set<K> newAcceptingStates,
                                          Collection<Transition<K, Guard>> transitions, boolean deterministic) {
        SymbolicAutomaton result = newEmptyInstance();
        Map<K, Integer> stateToIndex = new HashMap<>();
        stateToIndex.put(newInitialState, result.createState());
        for (K state : newStates) {
            if (!stateToIndex.containsKey(state)) {
                stateToIndex.put(state, result.createState());
            }
        }
        result.initialState = stateToIndex.get(newInitialState);
        for (K state : newAcceptingStates) {
            result.acceptingStates.add(stateToIndex.get(state));
        }
        for (Transition<K, Guard> transition : transitions) {
            result.putGuard(stateToIndex.get(transition.getSource()), transition.getLabel(),
                    stateToIndex.get(transition.getTarget()));
        }
        result.knownDeterministic = deterministic;
        logger.debug("重编号得到 {} 个状态，初始状态 {}。", result.states.size(), result.initialState);
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(initial=" + initialState + ", accepting=" + acceptingStates +
                ", transitions=" + transitionFunction + ")";
    }
}
