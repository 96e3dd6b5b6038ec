package com.polynomeer.tkv;

import com.polynomeer.tkv.client.NoScriptException;
import com.polynomeer.tkv.client.QueuedReply;
import com.polynomeer.tkv.client.StoreClient;
import com.polynomeer.tkv.client.StoreClientException;
import com.polynomeer.tkv.util.Clocks;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Key/value store over a Redis-compatible backend that keeps a sorted set of last-modified
 * timestamps next to the values, so records can be read back by time range.
 * <p>
 * Every write updates the value and its index entry in one MULTI/EXEC. Ranges can be read two ways:
 * {@link #fetchPage} issues count, select and fetch as separate commands (cheap, may observe
 * concurrent writes between the steps), {@link #fetchPageConsistent} runs all three inside one
 * server-side script. Both are {@link PageFunction}s and can be driven by {@link Paginator}.
 * <p>
 * Thread-safe as far as the given {@link StoreClient} is.
 */
public final class TimeKeyValueStore {

    static final String LAST_MODIFIED_INDEX = "lmIdx";

    private final StoreClient client;
    private final KeyComposer keys;
    private final String indexKey;
    private final RangeScript rangeScript = new RangeScript();

    /**
     * @param delimiter separates namespace and id segments, see {@link KeyComposer#DELIM_UNIT}
     * @param namespace key prefix keeping entity types apart; the id {@code "lmIdx"} is reserved
     */
    public TimeKeyValueStore(String delimiter, String namespace, StoreClient client) {
        this.client = client;
        this.keys = new KeyComposer(delimiter, namespace);
        this.indexKey = keys.compose(LAST_MODIFIED_INDEX);
    }

    /**
     * Value of an entity, or empty if there is none.
     */
    public Optional<byte[]> get(String... id) {
        ByteBuffer value;
        try {
            value = client.get(keys.compose(id));
        } catch (StoreClientException e) {
            throw new StoreException("failed to get entity", e);
        }
        return Optional.ofNullable(value).map(v -> Payload.of(v).toByteArray());
    }

    /**
     * Writes an entity, overwriting any previous value, and moves its index entry to
     * {@code lastModified}.
     *
     * @return true if the entity already existed
     * @throws IllegalArgumentException if {@code lastModified} is outside the epoch-nanosecond
     *                                  range (years 1677 to 2262); nothing is written
     */
    public boolean set(byte[] data, Instant lastModified, String... id) {
        String key = keys.compose(id);
        double score = score(lastModified);
        QueuedReply[] added = new QueuedReply[1];
        try {
            client.transaction(tx -> {
                tx.set(key, data);
                added[0] = tx.zadd(indexKey, score, key);
            });
            // ZADD replies 0 when it only updated the score
            return added[0].asLong() == 0;
        } catch (StoreClientException e) {
            throw new StoreException("failed to set entity", e);
        }
    }

    /**
     * Writes all records and their index entries in one MULTI/EXEC. An empty list is a no-op.
     * On failure nothing is rolled back beyond what the server's EXEC guarantees.
     *
     * @throws IllegalArgumentException if any timestamp is outside the epoch-nanosecond range;
     *                                  nothing is written
     */
    public void bulkSet(List<BulkSetRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        double[] scores = new double[records.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = score(records.get(i).lastModified());
        }
        try {
            client.transaction(tx -> {
                for (int i = 0; i < scores.length; i++) {
                    BulkSetRecord r = records.get(i);
                    String key = keys.compose(r.id().toArray(new String[0]));
                    tx.set(key, r.data());
                    tx.zadd(indexKey, scores[i], key);
                }
            });
        } catch (StoreClientException e) {
            throw new StoreException("failed to bulk insert records", e);
        }
    }

    public boolean exists(String... id) {
        try {
            return client.exists(keys.compose(id)) > 0;
        } catch (StoreClientException e) {
            throw new StoreException("failed to check if entity exists", e);
        }
    }

    /**
     * Removes the value and its index entry. Deleting a missing entity is not an error.
     */
    public void delete(String... id) {
        String key = keys.compose(id);
        try {
            client.transaction(tx -> {
                tx.del(key);
                tx.zrem(indexKey, key);
            });
        } catch (StoreClientException e) {
            throw new StoreException("failed to delete entity", e);
        }
    }

    /**
     * Timestamp of the entity's index entry. Scores are doubles, so nanosecond precision is lost
     * for timestamps beyond 2^53 ns (about 104 days after the epoch).
     */
    public Optional<Instant> lastModified(String... id) {
        Double score;
        try {
            score = client.zscore(indexKey, keys.compose(id));
        } catch (StoreClientException e) {
            throw new StoreException("failed to read last modified", e);
        }
        return Optional.ofNullable(score).map(s -> Clocks.fromEpochNanos(s.longValue()));
    }

    /**
     * Count, select and fetch as three separate commands.
     * <p>
     * Not atomic: under concurrent writes the page may hold fewer values than {@code total}
     * implies, absent payloads for entities deleted in between, or values whose last-modified
     * time moved out of the range after their key was selected.
     */
    public Page fetchPage(Instant from, Instant to, int offset, int limit) {
        String min = lowerBound(from);
        String max = upperBound(to);

        long total;
        try {
            total = client.zcount(indexKey, min, max);
        } catch (StoreClientException e) {
            throw new StoreException("failed to count", e);
        }

        List<String> selected;
        try {
            selected = client.zrangeByScore(indexKey, min, max, offset, limit);
        } catch (StoreClientException e) {
            throw new StoreException("failed to execute zrangebyscore", e);
        }
        if (selected.isEmpty()) {
            return Page.empty(total);
        }

        try {
            return new Page(total, client.mget(selected));
        } catch (StoreClientException e) {
            throw new StoreException("failed to execute mget", e);
        }
    }

    /**
     * Count, select and fetch inside one script evaluation, so {@code total} and the values are
     * one snapshot. The script holds the server for its whole run; keep pages to a few thousand
     * entries and paginate beyond that.
     *
     * @throws UnexpectedScriptResultException if the script reply does not have the expected shape
     */
    public Page fetchPageConsistent(Instant from, Instant to, int offset, int limit) {
        List<String> scriptKeys = List.of(indexKey);
        List<String> args = Arrays.asList(lowerBound(from), upperBound(to), Integer.toString(offset), Integer.toString(limit));

        Object result = evalRange(scriptKeys, args);
        if (!(result instanceof List) || ((List<?>) result).size() != 2) {
            throw new UnexpectedScriptResultException("expected a two-element array, got " + describe(result));
        }
        List<?> pair = (List<?>) result;
        if (!(pair.get(0) instanceof Long)) {
            throw new UnexpectedScriptResultException("expected an integer total, got " + describe(pair.get(0)));
        }
        if (!(pair.get(1) instanceof List)) {
            throw new UnexpectedScriptResultException("expected an array of values, got " + describe(pair.get(1)));
        }
        List<?> raw = (List<?>) pair.get(1);
        List<ByteBuffer> values = new ArrayList<>(raw.size());
        for (Object v : raw) {
            if (v != null && !(v instanceof ByteBuffer)) {
                throw new UnexpectedScriptResultException("expected bulk string values, got " + describe(v));
            }
            values.add((ByteBuffer) v);
        }
        return new Page((Long) pair.get(0), values);
    }

    private Object evalRange(List<String> scriptKeys, List<String> args) {
        String sha;
        try {
            sha = rangeScript.sha(client);
        } catch (StoreClientException e) {
            throw new StoreException("failed to load script", e);
        }
        try {
            return client.evalSha(sha, scriptKeys, args);
        } catch (NoScriptException e) {
            // server lost its script cache; register again once
            rangeScript.invalidate(sha);
        } catch (StoreClientException e) {
            throw new StoreException("failed to execute range script", e);
        }
        try {
            return client.evalSha(rangeScript.sha(client), scriptKeys, args);
        } catch (StoreClientException e) {
            throw new StoreException("failed to execute range script", e);
        }
    }

    private static double score(Instant lastModified) {
        if (!Clocks.fitsEpochNanos(lastModified)) {
            throw new IllegalArgumentException("lastModified out of range: " + lastModified);
        }
        return Clocks.epochNanos(lastModified);
    }

    // Bounds past either end of the nanosecond range clamp to the infinities; "(+inf" and "(-inf"
    // match nothing.
    private static String lowerBound(Instant from) {
        if (from == null || from.isBefore(Clocks.MIN_NANOS_INSTANT)) return "-inf";
        if (from.isAfter(Clocks.MAX_NANOS_INSTANT)) return "(+inf";
        return Long.toString(Clocks.epochNanos(from));
    }

    private static String upperBound(Instant to) {
        if (to == null || to.isAfter(Clocks.MAX_NANOS_INSTANT)) return "+inf";
        if (to.isBefore(Clocks.MIN_NANOS_INSTANT)) return "(-inf";
        return Long.toString(Clocks.epochNanos(to));
    }

    private static String describe(Object o) {
        return o == null ? "nil" : o.getClass().getSimpleName();
    }
}
