package org.automatakit.automata.symbolic;

import org.automatakit.automata.exceptions.InvalidSymbolException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValuationTest {

    @Test
    @DisplayName("未赋值的命题为 false")
    void testDefaultsToFalse() {
        Valuation valuation = Valuation.of(Map.of("a", true, "b", false));
        assertAll(
                () -> assertTrue(valuation.getValue("a")),
                () -> assertFalse(valuation.getValue("b")),
                () -> assertFalse(valuation.getValue("c")),
                () -> assertEquals(Valuation.trueOf("a"), Valuation.of(Map.of("a", true)))
        );
    }

    @Test
    @DisplayName("非法赋值抛出 InvalidSymbolException")
    void testInvalidValuations() {
        Map<String, Boolean> nullValue = new HashMap<>();
        nullValue.put("a", null);
        Map<String, Boolean> nullKey = new HashMap<>();
        nullKey.put(null, true);

        assertAll(
                () -> assertThrows(InvalidSymbolException.class, () -> Valuation.of(null)),
                () -> assertThrows(InvalidSymbolException.class, () -> Valuation.of(nullValue)),
                () -> assertThrows(InvalidSymbolException.class, () -> Valuation.of(nullKey)),
                () -> assertThrows(InvalidSymbolException.class, () -> Valuation.of(Map.of(" ", true))),
                () -> assertThrows(InvalidSymbolException.class, () -> Valuation.trueOf("a", null))
        );
    }

    @Test
    @DisplayName("赋值不受外部 Map 修改的影响")
    void testDefensiveCopy() {
        Map<String, Boolean> values = new HashMap<>(Map.of("a", true));
        Valuation valuation = Valuation.of(values);
        values.put("a", false);

        assertTrue(valuation.getValue("a"));
        assertThrows(UnsupportedOperationException.class, () -> valuation.getAssignment().put("b", true));
    }
}
