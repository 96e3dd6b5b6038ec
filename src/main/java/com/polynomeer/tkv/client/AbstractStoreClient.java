package com.polynomeer.tkv.client;

import com.polynomeer.tkv.resp.ErrorReply;
import com.polynomeer.tkv.resp.RespReader;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Builds command frames and decodes replies; subclasses only move frames.
 */
public abstract class AbstractStoreClient implements StoreClient {

    /**
     * Sends the frames in order, pipelined, and returns one decoded reply per frame, as produced
     * by {@link RespReader#tryReadReply}. Error replies are returned, not thrown.
     */
    protected abstract List<Object> roundTrip(List<List<byte[]>> frames);

    @Override
    public String ping() {
        Object r = call("PING");
        if (r instanceof ByteBuffer) return utf8((ByteBuffer) r);
        return expect("PING", r, String.class);
    }

    @Override
    public ByteBuffer get(String key) {
        return expectNullable("GET", call("GET", key), ByteBuffer.class);
    }

    @Override
    public long exists(String key) {
        return expect("EXISTS", call("EXISTS", key), Long.class);
    }

    @Override
    public List<ByteBuffer> mget(List<String> keys) {
        Object[] parts = new Object[keys.size() + 1];
        parts[0] = "MGET";
        for (int i = 0; i < keys.size(); i++) parts[i + 1] = keys.get(i);
        List<?> reply = expect("MGET", call(parts), List.class);
        List<ByteBuffer> out = new ArrayList<>(reply.size());
        for (Object o : reply) out.add(expectNullable("MGET", o, ByteBuffer.class));
        return out;
    }

    @Override
    public long zcount(String key, String min, String max) {
        return expect("ZCOUNT", call("ZCOUNT", key, min, max), Long.class);
    }

    @Override
    public List<String> zrangeByScore(String key, String min, String max, long offset, long count) {
        Object r = call("ZRANGEBYSCORE", key, min, max, "LIMIT", Long.toString(offset), Long.toString(count));
        List<?> reply = expect("ZRANGEBYSCORE", r, List.class);
        List<String> out = new ArrayList<>(reply.size());
        for (Object o : reply) out.add(utf8(expect("ZRANGEBYSCORE", o, ByteBuffer.class)));
        return out;
    }

    @Override
    public Double zscore(String key, String member) {
        ByteBuffer reply = expectNullable("ZSCORE", call("ZSCORE", key, member), ByteBuffer.class);
        if (reply == null) return null;
        try {
            return Double.valueOf(utf8(reply));
        } catch (NumberFormatException e) {
            throw new StoreClientException("ZSCORE: unexpected reply " + utf8(reply), e);
        }
    }

    @Override
    public String scriptLoad(String script) {
        return utf8(expect("SCRIPT", call("SCRIPT", "LOAD", script), ByteBuffer.class));
    }

    @Override
    public Object evalSha(String sha, List<String> keys, List<String> args) {
        List<Object> parts = new ArrayList<>(3 + keys.size() + args.size());
        parts.add("EVALSHA");
        parts.add(sha);
        parts.add(Integer.toString(keys.size()));
        parts.addAll(keys);
        parts.addAll(args);
        return call(parts.toArray());
    }

    @Override
    public void transaction(Consumer<Transaction> body) {
        QueuingTransaction tx = new QueuingTransaction();
        body.accept(tx);
        if (tx.frames.isEmpty()) return;

        List<List<byte[]>> frames = new ArrayList<>(tx.frames.size() + 2);
        frames.add(frame("MULTI"));
        frames.addAll(tx.frames);
        frames.add(frame("EXEC"));
        List<Object> replies = roundTrip(frames);

        checked("MULTI", replies.get(0));
        Object exec = replies.get(replies.size() - 1);
        if (exec instanceof ErrorReply) {
            // EXECABORT: report the command that was rejected while queuing
            for (int i = 1; i < replies.size() - 1; i++) {
                checked(tx.names.get(i - 1), replies.get(i));
            }
            checked("EXEC", exec);
        }
        if (!(exec instanceof List)) {
            throw new StoreClientException("EXEC: transaction aborted");
        }
        List<?> results = (List<?>) exec;
        if (results.size() != tx.replies.size()) {
            throw new StoreClientException("EXEC: expected " + tx.replies.size() + " replies, got " + results.size());
        }
        for (int i = 0; i < results.size(); i++) {
            tx.replies.get(i).complete(checked(tx.names.get(i), results.get(i)));
        }
    }

    // ---------- helpers ----------

    private Object call(Object... parts) {
        String name = (String) parts[0];
        List<Object> replies = roundTrip(List.of(frame(parts)));
        return checked(name, replies.get(0));
    }

    /**
     * Converts NIL to null and error replies to exceptions, recursively.
     */
    static Object checked(String command, Object reply) {
        if (reply == RespReader.NIL) return null;
        if (reply instanceof ErrorReply) {
            ErrorReply err = (ErrorReply) reply;
            if ("NOSCRIPT".equals(err.code())) {
                throw new NoScriptException(command + ": " + err.message());
            }
            throw new StoreClientException(command + ": " + err.message());
        }
        if (reply instanceof List) {
            List<?> in = (List<?>) reply;
            List<Object> out = new ArrayList<>(in.size());
            for (Object o : in) out.add(checked(command, o));
            return out;
        }
        return reply;
    }

    static <T> T expect(String command, Object reply, Class<T> type) {
        if (reply == null) throw new StoreClientException(command + ": unexpected nil reply");
        return expectNullable(command, reply, type);
    }

    static <T> T expectNullable(String command, Object reply, Class<T> type) {
        if (reply != null && !type.isInstance(reply)) {
            throw new StoreClientException(command + ": unexpected reply " + reply.getClass().getSimpleName()
                    + ", expected " + type.getSimpleName());
        }
        return type.cast(reply);
    }

    static List<byte[]> frame(Object... parts) {
        List<byte[]> argv = new ArrayList<>(parts.length);
        for (Object p : parts) {
            argv.add(p instanceof byte[] ? (byte[]) p : ((String) p).getBytes(StandardCharsets.UTF_8));
        }
        return argv;
    }

    static String utf8(ByteBuffer buf) {
        ByteBuffer b = buf.duplicate();
        byte[] arr = new byte[b.remaining()];
        b.get(arr);
        return new String(arr, StandardCharsets.UTF_8);
    }

    private static final class QueuingTransaction implements Transaction {
        final List<List<byte[]>> frames = new ArrayList<>();
        final List<String> names = new ArrayList<>();
        final List<QueuedReply> replies = new ArrayList<>();

        private QueuedReply queue(Object... parts) {
            String name = (String) parts[0];
            QueuedReply reply = new QueuedReply(name);
            frames.add(frame(parts));
            names.add(name);
            replies.add(reply);
            return reply;
        }

        @Override
        public QueuedReply set(String key, byte[] value) {
            return queue("SET", key, value);
        }

        @Override
        public QueuedReply del(String key) {
            return queue("DEL", key);
        }

        @Override
        public QueuedReply zadd(String key, double score, String member) {
            return queue("ZADD", key, formatScore(score), member);
        }

        @Override
        public QueuedReply zrem(String key, String member) {
            return queue("ZREM", key, member);
        }
    }

    private static String formatScore(double score) {
        if (score == Math.rint(score) && Math.abs(score) < 0x1p63) return Long.toString((long) score);
        return Double.toString(score);
    }
}
