package com.polynomeer.tkv.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ClocksTest {

    @Test
    void epoch_nanos_round_trip() {
        Instant t = Instant.ofEpochSecond(1_735_689_600L, 123_456_789);
        assertEquals(1_735_689_600_123_456_789L, Clocks.epochNanos(t));
        assertEquals(t, Clocks.fromEpochNanos(Clocks.epochNanos(t)));
    }

    @Test
    void negative_epoch_nanos() {
        Instant t = Instant.ofEpochSecond(-1, 500);
        assertEquals(-999_999_500L, Clocks.epochNanos(t));
        assertEquals(t, Clocks.fromEpochNanos(-999_999_500L));
    }

    @Test
    void out_of_range_instant_is_rejected() {
        assertThrows(ArithmeticException.class, () -> Clocks.epochNanos(Instant.MAX));
    }
}
