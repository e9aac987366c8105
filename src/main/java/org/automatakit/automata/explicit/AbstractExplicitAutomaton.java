package org.automatakit.automata.explicit;

import lombok.Getter;
import org.automatakit.automata.base.Alphabet;
import org.automatakit.automata.base.FiniteAutomaton;
import org.automatakit.automata.exceptions.InvalidSymbolException;
import org.automatakit.automata.exceptions.StructuralViolationException;
import org.automatakit.automata.exceptions.UnknownStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 显式自动机（DFA 与 NFA）的公共部分：状态、字母表、初始状态、接受状态以及构造时的校验。
 * 状态与符号都是字符串，空字符串为保留名称。
 * 子类是不可变的，所有变换都返回新实例。
 * @author Ayalyt
 */
@Getter
public abstract class AbstractExplicitAutomaton implements FiniteAutomaton<String, String, String> {

    private static final Logger logger = LoggerFactory.getLogger(AbstractExplicitAutomaton.class);

    static final String SINK_NAME = "sink";

    private final SortedSet<String> states;
    private final Alphabet alphabet;
    private final String initialState;
    private final SortedSet<String> acceptingStates;

    /**
     * 构造并校验显式自动机的静态组件。迁移函数的校验由子类在此之后完成。
     *
     * @param states          状态集合，不能为空。
     * @param alphabet        字母表。
     * @param initialState    初始状态，必须属于 states。
     * @param acceptingStates 接受状态集合，必须是 states 的子集。
     * @throws StructuralViolationException 如果任何结构约束不满足。
     */
    protected AbstractExplicitAutomaton(Set<String> states, Alphabet alphabet, String initialState,
                                        Set<String> acceptingStates) {
        Objects.requireNonNull(states, "States cannot be null.");
        this.alphabet = Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        Objects.requireNonNull(acceptingStates, "Accepting states cannot be null.");

        if (states.isEmpty()) {
            logger.error("状态集合为空。");
            throw new StructuralViolationException("状态集合不能为空。");
        }
        if (states.stream().anyMatch(Objects::isNull)) {
            logger.error("状态集合 {} 中包含 null。", states);
            throw new StructuralViolationException("状态不能为 null。");
        }
        if (states.contains(Alphabet.EPSILON)) {
            logger.error("状态集合 {} 使用了保留名称。", states);
            throw new StructuralViolationException("空字符串是保留名称，不能作为状态。");
        }
        if (initialState == null || !states.contains(initialState)) {
            logger.error("初始状态 {} 不在状态集合 {} 中。", initialState, states);
            throw new StructuralViolationException("初始状态 " + initialState + " 不在状态集合中。");
        }
        if (!states.containsAll(acceptingStates)) {
            Set<String> wrongStates = acceptingStates.stream()
                    .filter(s -> !states.contains(s))
                    .collect(Collectors.toCollection(TreeSet::new));
            logger.error("接受状态 {} 不在状态集合中。", wrongStates);
            throw new StructuralViolationException("接受状态 " + wrongStates + " 不在状态集合中。");
        }

        this.states = Collections.unmodifiableSortedSet(new TreeSet<>(states));
        this.initialState = initialState;
        this.acceptingStates = Collections.unmodifiableSortedSet(new TreeSet<>(acceptingStates));
    }

    @Override
    public Set<String> getInitialStates() {
        return Set.of(initialState);
    }

    /**
     * 校验迁移函数中出现的状态与符号。
     * @param referencedStates  迁移函数中出现的所有状态（源与目标）。
     * @param referencedSymbols 迁移函数中出现的所有符号。
     */
    protected final void checkTransitionFunction(Set<String> referencedStates, Set<String> referencedSymbols) {
        if (!states.containsAll(referencedStates)) {
            Set<String> wrongStates = referencedStates.stream()
                    .filter(s -> !states.contains(s))
                    .collect(Collectors.toCollection(TreeSet::new));
            logger.error("迁移函数引用了不存在的状态 {}。", wrongStates);
            throw new StructuralViolationException("迁移函数不合法：状态 " + wrongStates + " 不在状态集合中。");
        }
        if (!alphabet.containsAll(referencedSymbols)) {
            Set<String> wrongSymbols = referencedSymbols.stream()
                    .filter(s -> !alphabet.contains(s))
                    .collect(Collectors.toCollection(TreeSet::new));
            logger.error("迁移函数引用了不存在的符号 {}。", wrongSymbols);
            throw new StructuralViolationException("迁移函数不合法：符号 " + wrongSymbols + " 不在字母表中。");
        }
    }

    protected final void checkState(String state) {
        if (!states.contains(state)) {
            logger.error("查询了不存在的状态 {}。", state);
            throw new UnknownStateException(state);
        }
    }

    protected final void checkSymbol(String symbol) {
        if (symbol == null || !alphabet.contains(symbol)) {
            logger.error("符号 {} 不属于字母表 {}。", symbol, alphabet);
            throw new InvalidSymbolException("符号 " + symbol + " 不属于字母表。");
        }
    }

    /**
     * 生成一个不与现有状态冲突的 sink 状态名：sink, _sink, __sink, ...
     * @param existingStates 现有状态。
     * @return 新的状态名。
     */
    static String generateSinkName(Set<String> existingStates) {
        String sinkName = SINK_NAME;
        while (existingStates.contains(sinkName)) {
            sinkName = "_" + sinkName;
        }
        return sinkName;
    }

    /**
     * 宏状态（原状态的集合）的名称：成员排序后形如 {a, b, c}。
     * 状态名本身可能含有分隔符，因此不同的集合可能得到相同的文本；此时在名称前补 "_" 直到不与已分配的名称冲突。
     * @param members   宏状态的成员。
     * @param usedNames 已分配的名称，新名称会被加入其中。
     * @return 名称。
     */
    static String macroStateName(Collection<String> members, Set<String> usedNames) {
        String name = new TreeSet<>(members).stream().collect(Collectors.joining(", ", "{", "}"));
        while (usedNames.contains(name)) {
            name = "_" + name;
        }
        usedNames.add(name);
        return name;
    }
}
