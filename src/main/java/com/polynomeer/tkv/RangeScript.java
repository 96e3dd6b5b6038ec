package com.polynomeer.tkv;

import com.polynomeer.tkv.client.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;

/**
 * The server-side range-and-fetch script and its cached SHA-1 handle.
 * <p>
 * The handle is loaded by the first caller; later callers read it without locking. A failed load
 * caches nothing, and {@link #invalidate} drops a handle the server no longer knows.
 */
final class RangeScript {
    private static final Logger log = LoggerFactory.getLogger(RangeScript.class);

    // KEYS[1] sorted set; ARGV min, max, offset, count. Returns { total, values }.
    static final String SOURCE = ""
            + "local key = KEYS[1]\n"
            + "local min = ARGV[1]\n"
            + "local max = ARGV[2]\n"
            + "local offset = tonumber(ARGV[3])\n"
            + "local count = tonumber(ARGV[4])\n"
            + "local unpack = unpack or table.unpack\n"
            + "\n"
            + "local total = redis.call(\"ZCOUNT\", key, min, max)\n"
            + "if total == 0 then\n"
            + "  return { 0, {} }\n"
            + "end\n"
            + "\n"
            + "local keys = redis.call(\"ZRANGE\", key, min, max, \"BYSCORE\", \"LIMIT\", offset, count)\n"
            + "if #keys == 0 then\n"
            + "  return { total, {} }\n"
            + "end\n"
            + "\n"
            + "return { total, redis.call(\"MGET\", unpack(keys)) }\n";

    private final ReentrantLock lock = new ReentrantLock();
    private volatile String sha;

    String sha(StoreClient client) {
        String s = sha;
        if (s != null) return s;
        lock.lock();
        try {
            if (sha == null) {
                sha = client.scriptLoad(SOURCE);
                log.debug("registered range script {}", sha);
            }
            return sha;
        } finally {
            lock.unlock();
        }
    }

    void invalidate(String stale) {
        lock.lock();
        try {
            if (stale.equals(sha)) sha = null;
        } finally {
            lock.unlock();
        }
    }
}
