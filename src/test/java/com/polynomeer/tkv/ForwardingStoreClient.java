package com.polynomeer.tkv;

import com.polynomeer.tkv.client.StoreClient;
import com.polynomeer.tkv.client.Transaction;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Delegates to another client and counts script traffic; tests override single methods.
 */
class ForwardingStoreClient implements StoreClient {
    final StoreClient delegate;
    final AtomicInteger scriptLoads = new AtomicInteger();
    final AtomicInteger evals = new AtomicInteger();

    ForwardingStoreClient(StoreClient delegate) {
        this.delegate = delegate;
    }

    @Override
    public String ping() {
        return delegate.ping();
    }

    @Override
    public ByteBuffer get(String key) {
        return delegate.get(key);
    }

    @Override
    public long exists(String key) {
        return delegate.exists(key);
    }

    @Override
    public List<ByteBuffer> mget(List<String> keys) {
        return delegate.mget(keys);
    }

    @Override
    public long zcount(String key, String min, String max) {
        return delegate.zcount(key, min, max);
    }

    @Override
    public List<String> zrangeByScore(String key, String min, String max, long offset, long count) {
        return delegate.zrangeByScore(key, min, max, offset, count);
    }

    @Override
    public Double zscore(String key, String member) {
        return delegate.zscore(key, member);
    }

    @Override
    public String scriptLoad(String script) {
        scriptLoads.incrementAndGet();
        return delegate.scriptLoad(script);
    }

    @Override
    public Object evalSha(String sha, List<String> keys, List<String> args) {
        evals.incrementAndGet();
        return delegate.evalSha(sha, keys, args);
    }

    @Override
    public void transaction(Consumer<Transaction> body) {
        delegate.transaction(body);
    }

    @Override
    public void close() {
        delegate.close();
    }
}
