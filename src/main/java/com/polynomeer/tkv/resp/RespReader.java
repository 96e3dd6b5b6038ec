package com.polynomeer.tkv.resp;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal RESP reader.
 * <p>
 * Server side it parses command frames (Array of Bulk Strings); client side it parses replies of
 * any type. Both are safe for pipelining: they return null if the buffer does not hold a full frame.
 * The position may have moved in that case; callers save it beforehand and restore it.
 */
public class RespReader {

    /**
     * Decoded null bulk string or null array.
     */
    public static final Object NIL = new Object() {
        @Override
        public String toString() {
            return "(nil)";
        }
    };

    /**
     * Try to parse one command frame: Array of Bulk Strings.
     *
     * @param buf ByteBuffer in READ mode; position will advance on success.
     * @return argv list if a full frame is available, or null if need more bytes.
     */
    public List<String> tryReadCommand(ByteBuffer buf) {
        if (!buf.hasRemaining()) return null;

        byte b = buf.get(buf.position());
        if (b != '*') {
            // Clients always send arrays for commands; complain once the whole line is here.
            if (tryReadLine(buf) == null) return null;
            throw new RespError("Protocol error: expected Array '*'");
        }

        Long count = tryReadIntegerPrefix(buf, '*');
        if (count == null) return null;
        if (count <= 0) throw new RespError("Protocol error: empty command");

        List<String> argv = new ArrayList<>(count.intValue());
        for (int i = 0; i < count; i++) {
            if (!buf.hasRemaining()) return null;
            if (buf.get(buf.position()) != '$') throw new RespError("Protocol error: expected '$'");
            Object s = tryReadBulk(buf);
            if (s == null) return null;
            if (s == NIL) throw new RespError("Protocol error: null bulk in command");
            ByteBuffer bytes = (ByteBuffer) s;
            byte[] arr = new byte[bytes.remaining()];
            bytes.get(arr);
            argv.add(new String(arr, RespWriter.CHARSET));
        }
        return argv;
    }

    /**
     * Try to parse one reply of any type.
     *
     * @return String (simple string), Long (integer), ByteBuffer (bulk; a read-only view into
     * {@code buf}), List (array), {@link ErrorReply}, {@link #NIL}, or null if incomplete.
     */
    public Object tryReadReply(ByteBuffer buf) {
        if (!buf.hasRemaining()) return null;
        byte type = buf.get(buf.position());
        switch (type) {
            case '+': {
                String line = tryReadLine(buf);
                return line == null ? null : line.substring(1);
            }
            case '-': {
                String line = tryReadLine(buf);
                return line == null ? null : new ErrorReply(line.substring(1));
            }
            case ':':
                return tryReadIntegerPrefix(buf, ':');
            case '$':
                return tryReadBulk(buf);
            case '*': {
                Long n = tryReadIntegerPrefix(buf, '*');
                if (n == null) return null;
                if (n < 0) return NIL;
                List<Object> items = new ArrayList<>(n.intValue());
                for (long i = 0; i < n; i++) {
                    Object item = tryReadReply(buf);
                    if (item == null) return null;
                    items.add(item);
                }
                return items;
            }
            default:
                throw new RespError("Protocol error: unexpected reply type '" + (char) type + "'");
        }
    }

    /**
     * Try read "$<len>\r\n<bytes>\r\n" returning a read-only slice, NIL for $-1, or null if incomplete.
     */
    private Object tryReadBulk(ByteBuffer buf) {
        Long len = tryReadIntegerPrefix(buf, '$');
        if (len == null) return null;
        if (len == -1) return NIL;
        if (len < 0) throw new RespError("Negative bulk length");
        if (buf.remaining() < len + 2) {
            return null; // not enough bytes for payload + CRLF
        }
        int start = buf.position();
        ByteBuffer payload = buf.slice(start, len.intValue()).asReadOnlyBuffer();
        buf.position(start + len.intValue());
        if (buf.get() != '\r' || buf.get() != '\n') {
            throw new RespError("Bulk string missing CRLF tail");
        }
        return payload;
    }

    /**
     * Try read "*<int>\r\n", "$<int>\r\n" or ":<int>\r\n"; consumes the whole header on success.
     */
    private Long tryReadIntegerPrefix(ByteBuffer buf, char prefix) {
        if (buf.get(buf.position()) != (byte) prefix) return null;
        String line = tryReadLine(buf);
        if (line == null) return null;
        try {
            return Long.parseLong(line.substring(1));
        } catch (NumberFormatException e) {
            throw new RespError("Invalid integer after prefix " + prefix + ": " + line, e);
        }
    }

    /**
     * Read a line ending with CRLF from the current position, prefix byte included.
     * On success advances past the CRLF; on an incomplete line leaves the position untouched.
     */
    private String tryReadLine(ByteBuffer buf) {
        int start = buf.position();
        for (int i = start; i + 1 < buf.limit(); i++) {
            if (buf.get(i) == '\r' && buf.get(i + 1) == '\n') {
                byte[] out = new byte[i - start];
                buf.get(out);
                buf.position(i + 2);
                return new String(out, RespWriter.CHARSET);
            }
        }
        return null;
    }
}
