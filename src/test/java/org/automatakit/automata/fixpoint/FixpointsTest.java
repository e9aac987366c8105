package org.automatakit.automata.fixpoint;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FixpointsTest {

    @Test
    @DisplayName("最小不动点：图上的可达集合")
    void testLeastFixpointComputesReachability() {
        Map<Integer, Set<Integer>> edges = Map.of(
                0, Set.of(1),
                1, Set.of(2),
                2, Set.of(0),
                3, Set.of(4),
                4, Set.of());
        Set<Integer> seed = Set.of(0);

        Set<Integer> reachable = Fixpoints.leastFixpointOverStates(seed, current -> {
            Set<Integer> next = new HashSet<>();
            current.forEach(s -> next.addAll(edges.get(s)));
            return next;
        });

        assertEquals(Set.of(0, 1, 2), reachable);
        assertEquals(Set.of(0), seed, "seed 不应被修改");
    }

    @Test
    @DisplayName("最小不动点：step 不产生新状态时立即返回 seed 的副本")
    void testLeastFixpointWithEmptyStep() {
        Set<String> result = Fixpoints.leastFixpointOverStates(Set.of("a", "b"), current -> Set.of());
        assertEquals(Set.of("a", "b"), result);
    }

    @Test
    @DisplayName("最大不动点：删除会连锁传播直到稳定")
    void testGreatestFixpointPropagatesRemovals() {
        // 关系 (i, i+1) 中，当 (i+1, i+2) 不在关系中时删除 (i, i+1)；(3, 4) 一开始就不在关系中
        Set<Pair<Integer, Integer>> seed = Set.of(Pair.of(0, 1), Pair.of(1, 2), Pair.of(2, 3), Pair.of(5, 6));

        Set<Pair<Integer, Integer>> result = Fixpoints.greatestFixpointOverStatePairs(seed, (pair, relation) ->
                pair.getLeft() < 3 && !relation.contains(Pair.of(pair.getLeft() + 1, pair.getRight() + 1)));

        assertEquals(Set.of(Pair.of(5, 6)), result);
        assertEquals(4, seed.size(), "seed 不应被修改");
    }

    @Test
    @DisplayName("最大不动点：没有可删除的状态对时关系保持不变")
    void testGreatestFixpointStableSeed() {
        Set<Pair<String, String>> seed = Set.of(Pair.of("a", "a"), Pair.of("a", "b"));
        assertEquals(seed, Fixpoints.greatestFixpointOverStatePairs(seed, (pair, relation) -> false));
    }
}
