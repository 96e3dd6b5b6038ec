package com.polynomeer.tkv;

import java.time.Instant;

/**
 * Fetches one page of an index range. {@code null} bounds are open.
 * Implemented by {@link TimeKeyValueStore#fetchPage} and {@link TimeKeyValueStore#fetchPageConsistent}.
 */
@FunctionalInterface
public interface PageFunction {
    Page fetch(Instant from, Instant to, int offset, int limit);
}
