package com.polynomeer.tkv.struct;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoreRangeTest {

    @Test
    void parses_infinities_and_exclusive_bounds() {
        var r = ScoreRange.parse("(1.5", "+inf");
        assertFalse(r.contains(1.5));
        assertTrue(r.contains(1.6));
        assertTrue(r.contains(Double.MAX_VALUE));

        var open = ScoreRange.parse("-inf", "inf");
        assertTrue(open.contains(Double.NEGATIVE_INFINITY));
        assertTrue(open.contains(0));
    }

    @Test
    void rejects_non_numbers() {
        assertThrows(IllegalArgumentException.class, () -> ScoreRange.parse("abc", "1"));
        assertThrows(IllegalArgumentException.class, () -> ScoreRange.parseScore("NaN"));
    }

    @Test
    void formats_integral_scores_without_fraction() {
        assertEquals("1735732800000000000", ScoreRange.format(1735732800000000000d));
        assertEquals("-3", ScoreRange.format(-3));
        assertEquals("2.5", ScoreRange.format(2.5));
        assertEquals("inf", ScoreRange.format(Double.POSITIVE_INFINITY));
        assertEquals("-inf", ScoreRange.format(Double.NEGATIVE_INFINITY));
    }
}
