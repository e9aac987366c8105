package org.automatakit.automata.fixpoint;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * 两种不动点迭代：状态集合上的最小不动点，以及状态对关系上的最大不动点。
 * 可达性、余可达性与基于互模拟的最小化都建立在这两个操作之上。
 * 两者都在有限域上单调迭代，因此必然终止。
 * @author Ayalyt
 */
public final class Fixpoints {

    private static final Logger logger = LoggerFactory.getLogger(Fixpoints.class);

    private Fixpoints() {
    }

    /**
     * 计算包含 seed 且对 step 封闭的最小状态集合：反复计算 current ∪ step(current) 直到不再变化。
     *
     * @param seed 初始集合。
     * @param step 单步扩展函数，只需返回新增的候选状态。
     * @param <S>  状态类型。
     * @return 最小不动点（新的集合，seed 不会被修改）。
     */
    public static <S> Set<S> leastFixpointOverStates(Set<S> seed, Function<Set<S>, ? extends Collection<S>> step) {
        Objects.requireNonNull(seed, "Seed cannot be null.");
        Objects.requireNonNull(step, "Step function cannot be null.");
        Set<S> current = new HashSet<>(seed);
        int iterations = 0;
        boolean changed = true;
        while (changed) {
            iterations++;
            changed = current.addAll(step.apply(Set.copyOf(current)));
        }
        logger.debug("最小不动点在 {} 轮迭代后收敛，共 {} 个状态。", iterations, current.size());
        return current;
    }

    /**
     * 计算 seed 中最大的、在删除条件下保持稳定的子关系：
     * 每一轮用本轮开始时的关系快照评估 removeIf，删除所有满足条件的状态对，直到某一轮没有删除任何对。
     *
     * @param seed     初始关系。
     * @param removeIf 删除条件，参数为 (状态对, 当前关系)。
     * @param <S>      状态类型。
     * @return 最大不动点（新的集合，seed 不会被修改）。
     */
    public static <S> Set<Pair<S, S>> greatestFixpointOverStatePairs(Set<Pair<S, S>> seed,
                                                                     BiPredicate<Pair<S, S>, Set<Pair<S, S>>> removeIf) {
        Objects.requireNonNull(seed, "Seed cannot be null.");
        Objects.requireNonNull(removeIf, "Removal condition cannot be null.");
        Set<Pair<S, S>> current = new HashSet<>(seed);
        int iterations = 0;
        boolean changed = true;
        while (changed) {
            iterations++;
            Set<Pair<S, S>> snapshot = Set.copyOf(current);
            changed = current.removeIf(pair -> removeIf.test(pair, snapshot));
        }
        logger.debug("最大不动点在 {} 轮迭代后收敛，剩余 {} 个状态对。", iterations, current.size());
        return current;
    }
}
