package com.polynomeer.tkv.client;

import java.io.Closeable;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.function.Consumer;

/**
 * The subset of a Redis-compatible store that the time-indexed store relies on.
 * <p>
 * Keys and members are strings (sent as UTF-8); values are raw bytes. Returned buffers are
 * read-only views into the reply buffer of the round trip that produced them.
 * Every method throws {@link StoreClientException} on transport failure or error reply.
 */
public interface StoreClient extends Closeable {

    String ping();

    /**
     * Value of a string key, or null if absent.
     */
    ByteBuffer get(String key);

    long exists(String key);

    /**
     * Values in key order; null entries for missing keys.
     */
    List<ByteBuffer> mget(List<String> keys);

    long zcount(String key, String min, String max);

    List<String> zrangeByScore(String key, String min, String max, long offset, long count);

    /**
     * Score of a member, or null if absent.
     */
    Double zscore(String key, String member);

    /**
     * Registers a script and returns its SHA-1 handle.
     */
    String scriptLoad(String script);

    /**
     * Runs a registered script. The reply is decoded into Long, ByteBuffer, String, List or null.
     *
     * @throws NoScriptException if the server does not know the handle
     */
    Object evalSha(String sha, List<String> keys, List<String> args);

    /**
     * Queues the commands issued by {@code body} and runs them as one MULTI/EXEC unit.
     */
    void transaction(Consumer<Transaction> body);

    @Override
    void close();
}
