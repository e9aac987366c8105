package org.automatakit.automata.symbolic;

import org.automatakit.automata.exceptions.NonDeterminismException;
import org.automatakit.symbolic.BooleanAlgebra;
import org.automatakit.symbolic.TruthTableBooleanAlgebra;
import org.automatakit.symbolic.Z3BooleanAlgebra;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Stream;

import static org.automatakit.automata.symbolic.SymbolicAutomatonTest.allValuations;
import static org.automatakit.automata.symbolic.SymbolicAutomatonTest.assertSameLanguage;
import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SymbolicDFATest {

    private Z3BooleanAlgebra z3;

    @BeforeAll
    void setUp() {
        z3 = new Z3BooleanAlgebra();
    }

    @AfterAll
    void tearDown() {
        z3.close();
    }

    Stream<BooleanAlgebra> algebras() {
        return Stream.of(z3, new TruthTableBooleanAlgebra());
    }

    /**
     * 0 --a--> 1, 0 --~a &amp; b--> 2, 1 --true--> 1，接受 {1}。
     */
    private static SymbolicDFA sampleDFA(BooleanAlgebra algebra) {
        SymbolicDFA dfa = new SymbolicDFA(algebra);
        int s1 = dfa.createState();
        int s2 = dfa.createState();
        dfa.addTransition(0, "a", s1);
        dfa.addTransition(0, "~a & b", s2);
        dfa.addTransition(s1, "true", s1);
        dfa.setAcceptingState(s1, true);
        return dfa;
    }

    @ParameterizedTest(autoCloseArguments = false)
    @MethodSource("algebras")
    @DisplayName("与其他目标重叠的守卫被拒绝，且自动机保持不变")
    void testOverlappingGuardIsRejected(BooleanAlgebra algebra) {
        SymbolicDFA dfa = sampleDFA(algebra);

        assertThrows(NonDeterminismException.class, () -> dfa.addTransition(0, "a & c", 2));
        assertThrows(NonDeterminismException.class, () -> dfa.addTransition(0, "b", 1));
        assertEquals(algebra.parse("a"), dfa.getTransitionFunction().get(0).get(1));
    }

    @ParameterizedTest(autoCloseArguments = false)
    @MethodSource("algebras")
    @DisplayName("同一目标上的重叠守卫与互斥守卫都被接受")
    void testCompatibleGuardsAreAccepted(BooleanAlgebra algebra) {
        SymbolicDFA dfa = sampleDFA(algebra);
        dfa.addTransition(0, "a & c", 1);
        int s3 = dfa.createState();
        dfa.addTransition(0, "~a & ~b & c", s3);

        assertEquals(OptionalInt.of(1), dfa.getSuccessor(0, Valuation.trueOf("a")));
        assertEquals(OptionalInt.of(1), dfa.getSuccessor(0, Valuation.trueOf("a", "c")));
        assertEquals(OptionalInt.of(s3), dfa.getSuccessor(0, Valuation.trueOf("c")));
    }

    @ParameterizedTest(autoCloseArguments = false)
    @MethodSource("algebras")
    @DisplayName("getSuccessor 返回唯一后继或空")
    void testGetSuccessor(BooleanAlgebra algebra) {
        SymbolicDFA dfa = sampleDFA(algebra);

        assertAll(
                () -> assertEquals(OptionalInt.of(1), dfa.getSuccessor(0, Valuation.trueOf("a", "b"))),
                () -> assertEquals(OptionalInt.of(2), dfa.getSuccessor(0, Valuation.trueOf("b"))),
                () -> assertEquals(OptionalInt.empty(), dfa.getSuccessor(0, Valuation.empty())),
                () -> assertTrue(dfa.isDeterministic())
        );
    }

    @ParameterizedTest(autoCloseArguments = false)
    @MethodSource("algebras")
    @DisplayName("补全、确定化与最小化保持 SymbolicDFA 类型与确定性")
    void testAlgorithmsKeepDeterminism(BooleanAlgebra algebra) {
        SymbolicDFA dfa = sampleDFA(algebra);
        SymbolicDFA completed = dfa.complete();
        SymbolicDFA minimized = dfa.minimize();

        assertAll(
                () -> assertTrue(completed.isComplete()),
                () -> assertEquals(4, completed.size()),
                () -> assertInstanceOf(SymbolicDFA.class, dfa.determinize()),
                () -> assertEquals(3, minimized.size()),
                () -> assertTrue(minimized.isComplete())
        );
        for (SymbolicAutomaton automaton : List.of(dfa, completed, minimized)) {
            for (int state : automaton.getStates()) {
                for (Valuation valuation : allValuations(List.of("a", "b"))) {
                    assertTrue(automaton.getSuccessors(state, valuation).size() <= 1);
                }
            }
        }
        assertSameLanguage(dfa, completed, List.of("a", "b"), 3);
        assertSameLanguage(dfa, minimized, List.of("a", "b"), 3);
    }
}
