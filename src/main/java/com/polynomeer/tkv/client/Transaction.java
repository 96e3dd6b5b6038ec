package com.polynomeer.tkv.client;

/**
 * Commands queued between MULTI and EXEC. Replies are readable after
 * {@link StoreClient#transaction} returns.
 */
public interface Transaction {

    QueuedReply set(String key, byte[] value);

    QueuedReply del(String key);

    /**
     * Reply is 1 if the member was added, 0 if its score was updated.
     */
    QueuedReply zadd(String key, double score, String member);

    QueuedReply zrem(String key, String member);
}
