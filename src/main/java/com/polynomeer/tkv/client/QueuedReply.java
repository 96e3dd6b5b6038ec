package com.polynomeer.tkv.client;

/**
 * Reply of a command queued in a {@link Transaction}; filled once EXEC returns.
 */
public final class QueuedReply {
    private final String command;
    private Object value;
    private boolean done;

    QueuedReply(String command) {
        this.command = command;
    }

    void complete(Object value) {
        this.value = value;
        this.done = true;
    }

    public Object get() {
        if (!done) throw new IllegalStateException(command + " reply read before EXEC");
        return value;
    }

    public long asLong() {
        Object v = get();
        if (!(v instanceof Long)) throw new StoreClientException(command + ": expected integer reply, got " + v);
        return (Long) v;
    }
}
