package com.visprog.blueprint.resolve;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.visprog.blueprint.resolve.ValueEquality.sameValue;
import static org.junit.jupiter.api.Assertions.*;

public class ValueEqualityTest {

    @Test
    void numbersCompareByValue() {
        assertTrue(sameValue(10, 10L));
        assertTrue(sameValue(10, 10.0));
        assertTrue(sameValue(new BigDecimal("2.50"), 2.5));
        assertFalse(sameValue(10, 10.5));
    }

    @Test
    void nonFiniteNumbers() {
        assertTrue(sameValue(Double.NaN, Double.NaN));
        assertTrue(sameValue(Double.POSITIVE_INFINITY, Float.POSITIVE_INFINITY));
        assertFalse(sameValue(Double.NaN, 1));
    }

    @Test
    void listsAndMapsAreStructural() {
        assertTrue(sameValue(List.of(0, 0, 0), List.of(0.0, 0L, 0)));
        assertFalse(sameValue(List.of(0, 0), List.of(0, 0, 0)));
        assertTrue(sameValue(Map.of("a", List.of(1)), Map.of("a", List.of(1L))));
        assertFalse(sameValue(Map.of("a", 1), Map.of("b", 1)));
    }

    @Test
    void nullsAndOtherTypes() {
        assertTrue(sameValue(null, null));
        assertFalse(sameValue(null, 0));
        assertFalse(sameValue("1", 1));
        assertTrue(sameValue("a", "a"));
        assertFalse(sameValue(true, 1));
    }
}
