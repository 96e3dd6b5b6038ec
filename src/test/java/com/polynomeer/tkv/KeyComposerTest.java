package com.polynomeer.tkv;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyComposerTest {

    @Test
    void joins_namespace_and_segments_with_delimiter() {
        var keys = new KeyComposer(KeyComposer.DELIM_PIPE, "orders");
        assertEquals("orders|eu|42", keys.compose("eu", "42"));
        assertEquals("orders\u001fa\u001fb", new KeyComposer(KeyComposer.DELIM_UNIT, "orders").compose("a", "b"));
    }

    @Test
    void composing_twice_yields_identical_key() {
        var keys = new KeyComposer(KeyComposer.DELIM_UNIT, "ns");
        assertEquals(keys.compose("x", "y", "z"), keys.compose("x", "y", "z"));
    }

    @Test
    void no_segments_leaves_trailing_delimiter() {
        assertEquals("ns|", new KeyComposer("|", "ns").compose());
    }

    @Test
    void segments_containing_the_delimiter_can_collide() {
        var keys = new KeyComposer(KeyComposer.DELIM_PIPE, "ns");
        // documented caller contract: nothing prevents this
        assertEquals(keys.compose("a|b", "c"), keys.compose("a", "b|c"));
    }
}
