package org.automatakit.expressions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GuardParserTest {

    private static final Guard A = Guards.proposition("a");
    private static final Guard B = Guards.proposition("b");
    private static final Guard C = Guards.proposition("c");

    @Nested
    @DisplayName("解析")
    class ParsingTests {

        @Test
        @DisplayName("常量与命题")
        void testAtoms() {
            assertAll(
                    () -> assertEquals(Guards.TRUE, GuardParser.parse("true")),
                    () -> assertEquals(Guards.TRUE, GuardParser.parse("True")),
                    () -> assertEquals(Guards.FALSE, GuardParser.parse(" False ")),
                    () -> assertEquals(Guards.proposition("x_1"), GuardParser.parse("x_1"))
            );
        }

        @Test
        @DisplayName("& 比 | 结合更紧，括号改变优先级")
        void testPrecedence() {
            assertEquals(Guards.or(A, Guards.and(B, C)), GuardParser.parse("a | b & c"));
            assertEquals(Guards.and(Guards.or(A, B), C), GuardParser.parse("(a | b) & c"));
        }

        @Test
        @DisplayName("运算符的两种写法等价")
        void testOperatorAliases() {
            assertAll(
                    () -> assertEquals(GuardParser.parse("~a & b"), GuardParser.parse("!a && b")),
                    () -> assertEquals(GuardParser.parse("a | b"), GuardParser.parse("a || b")),
                    () -> assertEquals(GuardParser.parse("a -> b"), GuardParser.parse("a >> b"))
            );
        }

        @Test
        @DisplayName("蕴含、等价与异或按真值表求值")
        void testDerivedOperators() {
            Guard implies = GuardParser.parse("a -> b");
            Guard iff = GuardParser.parse("a <-> b");
            Guard xor = GuardParser.parse("a ^ b");
            for (boolean a : new boolean[]{false, true}) {
                for (boolean b : new boolean[]{false, true}) {
                    Map<String, Boolean> valuation = Map.of("a", a, "b", b);
                    assertEquals(!a || b, implies.evaluate(valuation));
                    assertEquals(a == b, iff.evaluate(valuation));
                    assertEquals(a != b, xor.evaluate(valuation));
                }
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "a &", "(a | b", "a b", "a $ b", "1a", "~"})
        @DisplayName("非法文本抛出 GuardParseException")
        void testParseErrors(String text) {
            GuardParseException exception = assertThrows(GuardParseException.class, () -> GuardParser.parse(text));
            assertEquals(text, exception.getExpression());
            assertInstanceOf(IllegalArgumentException.class, exception);
        }
    }

    @Nested
    @DisplayName("结构化简")
    class SimplificationTests {

        @Test
        @DisplayName("常量传播与双重否定")
        void testConstantsAndDoubleNegation() {
            assertAll(
                    () -> assertEquals(A, Guards.and(A, Guards.TRUE)),
                    () -> assertEquals(Guards.FALSE, Guards.and(A, Guards.FALSE)),
                    () -> assertEquals(Guards.TRUE, Guards.or(A, Guards.TRUE)),
                    () -> assertEquals(A, Guards.not(Guards.not(A))),
                    () -> assertEquals(Guards.FALSE, Guards.not(Guards.TRUE))
            );
        }

        @Test
        @DisplayName("互补文字")
        void testComplementaryLiterals() {
            assertEquals(Guards.FALSE, Guards.and(A, B, Guards.not(A)));
            assertEquals(Guards.TRUE, GuardParser.parse("a | ~a"));
        }

        @Test
        @DisplayName("展平、去重与排序使结构相同的公式相等")
        void testCanonicalForm() {
            Guard left = Guards.and(A, Guards.and(B, C));
            Guard right = Guards.and(C, B, A, B);
            assertEquals(left, right);
            assertEquals(left.hashCode(), right.hashCode());
            assertEquals(3, ((AndGuard) left).getOperands().size());
            assertEquals(Guards.or(A, B), Guards.or(B, A));
        }

        @Test
        @DisplayName("替换部分命题后剩余命题保持自由")
        void testSubstitute() {
            Guard guard = GuardParser.parse("a & (b | c)");
            assertEquals(Guards.or(B, C), guard.substitute(Map.of("a", true)));
            assertEquals(Guards.FALSE, guard.substitute(Map.of("a", false)));
            assertEquals(Set.of("a", "b", "c"), guard.getPropositions());
        }

        @Test
        @DisplayName("缺失的命题在求值时视为 false")
        void testEvaluateDefaultsToFalse() {
            assertFalse(A.evaluate(Map.of()));
            assertTrue(Guards.not(A).evaluate(Map.of()));
        }

        @Test
        @DisplayName("toString 可以被重新解析为同一个守卫")
        void testToStringRoundTrip() {
            Guard guard = GuardParser.parse("~(a | b) & c | ~c & a");
            assertEquals(guard, GuardParser.parse(guard.toString()));
        }
    }
}
