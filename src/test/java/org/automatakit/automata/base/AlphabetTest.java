package org.automatakit.automata.base;

import org.automatakit.automata.exceptions.InvalidSymbolException;
import org.automatakit.automata.exceptions.StructuralViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class AlphabetTest {

    @Test
    @DisplayName("符号与下标互为逆映射")
    void testSymbolAndIndexAreInverse() {
        Alphabet alphabet = Alphabet.of("a", "b", "c");

        assertAll("index <-> symbol",
                () -> assertEquals(3, alphabet.size()),
                () -> assertEquals("b", alphabet.getSymbol(1)),
                () -> assertEquals(2, alphabet.getSymbolIndex("c")),
                () -> assertEquals(0, alphabet.getSymbolIndex(alphabet.getSymbol(0))),
                () -> assertTrue(alphabet.contains("a")),
                () -> assertFalse(alphabet.contains("d"))
        );
    }

    @Test
    @DisplayName("range(n) 生成 \"0\" 到 \"n-1\"，迭代顺序即下标顺序")
    void testRange() {
        Alphabet alphabet = Alphabet.range(3);
        List<String> iterated = new ArrayList<>();
        alphabet.forEach(iterated::add);

        assertEquals(List.of("0", "1", "2"), iterated);
        assertEquals(Alphabet.of("0", "1", "2"), alphabet);
        assertThrows(IllegalArgumentException.class, () -> Alphabet.range(-1));
    }

    @Test
    @DisplayName("从集合构造时按集合的迭代顺序分配下标")
    void testOfCollection() {
        Alphabet alphabet = Alphabet.of(new TreeSet<>(Set.of("z", "x", "y")));
        assertEquals(List.of("x", "y", "z"), alphabet.getSymbols());
    }

    @Test
    @DisplayName("越界下标与未知符号抛出 InvalidSymbolException")
    void testInvalidLookups() {
        Alphabet alphabet = Alphabet.of("a");

        assertThrows(InvalidSymbolException.class, () -> alphabet.getSymbol(1));
        assertThrows(InvalidSymbolException.class, () -> alphabet.getSymbol(-1));
        assertThrows(InvalidSymbolException.class, () -> alphabet.getSymbolIndex("b"));
    }

    @Test
    @DisplayName("重复符号与保留的空字符串被拒绝")
    void testStructuralViolations() {
        assertThrows(StructuralViolationException.class, () -> Alphabet.of("a", "a"));
        assertThrows(StructuralViolationException.class, () -> Alphabet.of("a", Alphabet.EPSILON));
    }
}
