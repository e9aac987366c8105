package org.automatakit.automata.explicit;

import org.automatakit.automata.base.Alphabet;
import org.automatakit.automata.exceptions.InvalidSymbolException;
import org.automatakit.automata.exceptions.StructuralViolationException;
import org.automatakit.automata.exceptions.UnknownStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.automatakit.automata.explicit.ExplicitDFATest.allWords;
import static org.automatakit.automata.explicit.ExplicitDFATest.word;
import static org.junit.jupiter.api.Assertions.*;

class ExplicitNFATest {

    private static ExplicitNFA sampleNFA() {
        return new ExplicitNFA(
                Set.of("q0", "q1", "q2", "q3"),
                Alphabet.of("a", "b"),
                "q0",
                Set.of("q3"),
                Map.of(
                        "q0", Map.of("a", Set.of("q1")),
                        "q1", Map.of("a", Set.of("q0"), "b", Set.of("q1", "q2")),
                        "q2", Map.of("a", Set.of("q2"), "b", Set.of("q3"))));
    }

    @Nested
    @DisplayName("构造与查询")
    class QueryTests {

        @Test
        @DisplayName("后继集合与迁移枚举")
        void testSuccessorsAndTransitions() {
            ExplicitNFA nfa = sampleNFA();
            assertAll(
                    () -> assertEquals(Set.of("q1", "q2"), nfa.getSuccessors("q1", "b")),
                    () -> assertEquals(Set.of(), nfa.getSuccessors("q0", "b")),
                    () -> assertEquals(3, nfa.getTransitionsFrom("q1").size()),
                    () -> assertTrue(nfa.getTransitionsFrom("q3").isEmpty())
            );
        }

        @Test
        @DisplayName("非法组件与非法查询")
        void testValidation() {
            assertThrows(StructuralViolationException.class, () -> new ExplicitNFA(Set.of("q0"), Alphabet.of("a"), "q0",
                    Set.of(), Map.of("q0", Map.of("a", Set.of("q1")))));
            ExplicitNFA nfa = sampleNFA();
            assertThrows(UnknownStateException.class, () -> nfa.getSuccessors("q9", "a"));
            assertThrows(InvalidSymbolException.class, () -> nfa.getSuccessors("q0", "c"));
        }

        @Test
        @DisplayName("fromTransitions 推断状态与字母表，空目标集合被忽略")
        void testFromTransitions() {
            ExplicitNFA nfa = ExplicitNFA.fromTransitions("s", Set.of("t"), Map.of(
                    "s", Map.of("x", Set.of("s", "t"), "y", Set.of())));
            assertAll(
                    () -> assertEquals(Set.of("s", "t"), nfa.getStates()),
                    () -> assertEquals(Alphabet.of("x", "y"), nfa.getAlphabet()),
                    () -> assertFalse(nfa.getTransitionFunction().get("s").containsKey("y")),
                    () -> assertTrue(nfa.accepts(word("xx"))),
                    () -> assertFalse(nfa.accepts(word("y")))
            );
        }

        @Test
        @DisplayName("语言为空的判定")
        void testIsEmpty() {
            assertFalse(sampleNFA().isEmpty());
            ExplicitNFA unreachableAccepting = new ExplicitNFA(Set.of("q0", "q1"), Alphabet.of("a"), "q0", Set.of("q1"),
                    Map.of("q1", Map.of("a", Set.of("q0"))));
            assertTrue(unreachableAccepting.isEmpty());
        }
    }

    @Nested
    @DisplayName("子集构造")
    class DeterminizationTests {

        @Test
        @DisplayName("determinize().trim().minimize() 识别相同的语言")
        void testDeterminizeTrimMinimize() {
            ExplicitDFA dfa = sampleNFA().determinize().trim().minimize();

            assertAll(
                    () -> assertTrue(dfa.accepts(word("aaabbab"))),
                    () -> assertFalse(dfa.accepts(word(""))),
                    () -> assertFalse(dfa.accepts(word("a"))),
                    () -> assertFalse(dfa.accepts(word("b"))),
                    () -> assertFalse(dfa.accepts(word("aa"))),
                    () -> assertFalse(dfa.accepts(word("aba"))),
                    () -> assertFalse(dfa.accepts(word("aaab")))
            );
        }

        @Test
        @DisplayName("宏状态以成员命名，只生成可达的宏状态")
        void testMacroStates() {
            ExplicitDFA dfa = sampleNFA().determinize();

            assertAll(
                    () -> assertEquals("{q0}", dfa.getInitialState()),
                    () -> assertEquals("{q1}", dfa.getSuccessor("{q0}", "a")),
                    () -> assertEquals("{q1, q2}", dfa.getSuccessor("{q1}", "b")),
                    () -> assertNull(dfa.getSuccessor("{q0}", "b")),
                    () -> assertFalse(dfa.isComplete()),
                    () -> assertTrue(dfa.getAcceptingStates().stream().allMatch(s -> s.contains("q3")))
            );
        }

        @Test
        @DisplayName("子集构造保持语言")
        void testLanguagePreservation() {
            ExplicitNFA nfa = sampleNFA();
            ExplicitDFA dfa = nfa.determinize();
            ExplicitDFA minimized = dfa.minimize();
            for (List<String> w : allWords(nfa.getAlphabet(), 7)) {
                assertEquals(nfa.accepts(w), dfa.accepts(w), "determinize 改变了 " + w + " 的判定");
                assertEquals(nfa.accepts(w), minimized.accepts(w), "minimize 改变了 " + w + " 的判定");
            }
        }

        @Test
        @DisplayName("成员集合不同但文本相同的宏状态不会被合并")
        void testMacroStateNamesStayDistinct() {
            ExplicitNFA nfa = new ExplicitNFA(Set.of("i", "a", "b", "a, b", "f"), Alphabet.of("x", "y", "z"), "i",
                    Set.of("f"), Map.of(
                            "i", Map.of("x", Set.of("a", "b"), "y", Set.of("a, b")),
                            "a", Map.of("z", Set.of("f"))));
            ExplicitDFA dfa = nfa.determinize();

            assertAll(
                    () -> assertNotEquals(dfa.getSuccessor("{i}", "x"), dfa.getSuccessor("{i}", "y")),
                    () -> assertTrue(dfa.accepts(word("xz"))),
                    () -> assertFalse(dfa.accepts(word("yz")))
            );
            for (List<String> w : allWords(nfa.getAlphabet(), 3)) {
                assertEquals(nfa.accepts(w), dfa.accepts(w), "determinize 改变了 " + w + " 的判定");
                assertEquals(nfa.accepts(w), dfa.minimize().accepts(w), "minimize 改变了 " + w + " 的判定");
            }
        }
    }
}
