package com.polynomeer.tkv;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One entry of {@link TimeKeyValueStore#bulkSet}.
 */
public final class BulkSetRecord {
    private final byte[] data;
    private final Instant lastModified;
    private final List<String> id;

    public BulkSetRecord(byte[] data, Instant lastModified, String... id) {
        this.data = Objects.requireNonNull(data, "data");
        this.lastModified = Objects.requireNonNull(lastModified, "lastModified");
        this.id = Arrays.asList(id.clone());
    }

    public byte[] data() {
        return data;
    }

    public Instant lastModified() {
        return lastModified;
    }

    public List<String> id() {
        return id;
    }
}
