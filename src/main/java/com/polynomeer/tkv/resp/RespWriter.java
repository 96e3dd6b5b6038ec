package com.polynomeer.tkv.resp;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Minimal RESP writer helpers.
 * Returned ByteBuffers are flipped for reading (position = 0, limit = size).
 * <p>
 * Server-side strings carry raw bytes as ISO-8859-1 chars (one char per byte), which keeps
 * binary payloads intact through the keyspace.
 */
public class RespWriter {

    public static final Charset CHARSET = StandardCharsets.ISO_8859_1;

    private static final byte[] CRLF = {'\r', '\n'};

    public static ByteBuffer simpleString(String s) {
        byte[] b = s.getBytes(CHARSET);
        ByteBuffer buf = ByteBuffer.allocate(1 + b.length + 2);
        buf.put((byte) '+').put(b).put(CRLF);
        buf.flip();
        return buf;
    }

    public static ByteBuffer error(String s) {
        byte[] b = s.replace('\r', ' ').replace('\n', ' ').getBytes(CHARSET);
        ByteBuffer buf = ByteBuffer.allocate(1 + b.length + 2);
        buf.put((byte) '-').put(b).put(CRLF);
        buf.flip();
        return buf;
    }

    public static ByteBuffer bulkString(String s) {
        if (s == null) return nullBulk();
        ByteArrayOutputStream out = new ByteArrayOutputStream(s.length() + 16);
        writeBulk(out, s.getBytes(CHARSET));
        return ByteBuffer.wrap(out.toByteArray());
    }

    public static ByteBuffer integer(long v) {
        byte[] b = Long.toString(v).getBytes(CHARSET);
        ByteBuffer buf = ByteBuffer.allocate(1 + b.length + 2);
        buf.put((byte) ':').put(b).put(CRLF);
        buf.flip();
        return buf;
    }

    public static ByteBuffer nullBulk() {
        ByteBuffer buf = ByteBuffer.allocate(5);
        buf.put((byte) '$').put((byte) '-').put((byte) '1').put(CRLF);
        buf.flip();
        return buf;
    }

    // ---------- Arrays ----------

    /**
     * RESP Array of bulk strings; null elements are written as $-1 (MGET, ZRANGE).
     */
    public static ByteBuffer arrayOfBulk(List<String> items) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(64);
        writeHeader(out, '*', items.size());
        for (String s : items) {
            if (s == null) {
                out.writeBytes("$-1\r\n".getBytes(CHARSET));
            } else {
                writeBulk(out, s.getBytes(CHARSET));
            }
        }
        return ByteBuffer.wrap(out.toByteArray());
    }

    public static ByteBuffer arrayOfIntegers(int[] values) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(16 + values.length * 4);
        writeHeader(out, '*', values.length);
        for (int v : values) writeHeader(out, ':', v);
        return ByteBuffer.wrap(out.toByteArray());
    }

    /**
     * RESP Array whose elements are already-encoded replies (EXEC).
     */
    public static ByteBuffer arrayOfFrames(List<ByteBuffer> frames) {
        int size = 16;
        for (ByteBuffer f : frames) size += f.remaining();
        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.put(("*" + frames.size() + "\r\n").getBytes(CHARSET));
        for (ByteBuffer f : frames) buf.put(f.duplicate());
        buf.flip();
        return buf;
    }

    /**
     * Client side: a command frame, Array of Bulk Strings.
     */
    public static ByteBuffer command(List<byte[]> argv) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(64);
        writeHeader(out, '*', argv.size());
        for (byte[] a : argv) writeBulk(out, a);
        return ByteBuffer.wrap(out.toByteArray());
    }

    static void writeHeader(ByteArrayOutputStream out, char prefix, long n) {
        out.write(prefix);
        out.writeBytes(Long.toString(n).getBytes(CHARSET));
        out.writeBytes(CRLF);
    }

    static void writeBulk(ByteArrayOutputStream out, byte[] b) {
        writeHeader(out, '$', b.length);
        out.writeBytes(b);
        out.writeBytes(CRLF);
    }
}
