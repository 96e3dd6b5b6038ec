package com.polynomeer.tkv.client;

import com.polynomeer.tkv.resp.RespError;
import com.polynomeer.tkv.resp.RespReader;
import com.polynomeer.tkv.resp.RespWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Blocking RESP client over a single TCP connection. Round trips are serialized.
 * <p>
 * Each round trip decodes into a fresh buffer, so buffers returned by one call are not touched
 * by the next. After an I/O error the connection is closed and every later call fails.
 */
public final class RespStoreClient extends AbstractStoreClient {
    private static final Logger log = LoggerFactory.getLogger(RespStoreClient.class);

    private static final int READ_CHUNK = 16 * 1024;

    private final String address;
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final RespReader reader = new RespReader();
    private boolean broken;

    private RespStoreClient(String address, Socket socket) throws IOException {
        this.address = address;
        this.socket = socket;
        this.in = socket.getInputStream();
        this.out = new BufferedOutputStream(socket.getOutputStream(), READ_CHUNK);
    }

    /**
     * Connects with {@code timeout} as both the connect timeout and the per-read timeout.
     */
    public static RespStoreClient connect(String host, int port, Duration timeout) {
        String address = host + ":" + port;
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            socket.setSoTimeout((int) timeout.toMillis());
            socket.setTcpNoDelay(true);
            log.debug("connected to {}", address);
            return new RespStoreClient(address, socket);
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new StoreClientException("failed to connect to " + address, e);
        }
    }

    @Override
    protected synchronized List<Object> roundTrip(List<List<byte[]>> frames) {
        if (broken) throw new StoreClientException("connection to " + address + " is closed");
        try {
            for (List<byte[]> frame : frames) {
                ByteBuffer buf = RespWriter.command(frame);
                out.write(buf.array(), buf.arrayOffset() + buf.position(), buf.remaining());
            }
            out.flush();
            return readReplies(frames.size());
        } catch (IOException | RespError e) {
            broken = true;
            closeSocket();
            throw new StoreClientException("round trip to " + address + " failed", e);
        }
    }

    private List<Object> readReplies(int n) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(READ_CHUNK);
        buf.flip();
        List<Object> replies = new ArrayList<>(n);
        while (replies.size() < n) {
            int mark = buf.position();
            Object reply = reader.tryReadReply(buf);
            if (reply != null) {
                replies.add(reply);
                continue;
            }
            buf.position(mark);
            buf = fill(buf);
        }
        return replies;
    }

    /**
     * Appends socket bytes after the current limit. Bytes already decoded are never moved, since
     * earlier replies hold views into them; a full buffer is replaced by a larger one instead.
     */
    private ByteBuffer fill(ByteBuffer buf) throws IOException {
        if (buf.limit() == buf.capacity()) {
            int pending = buf.remaining();
            ByteBuffer bigger = ByteBuffer.allocate(Math.max(buf.capacity() * 2, pending + READ_CHUNK));
            bigger.put(buf);
            bigger.flip();
            buf = bigger;
        }
        int n = in.read(buf.array(), buf.arrayOffset() + buf.limit(), buf.capacity() - buf.limit());
        if (n < 0) throw new EOFException("connection closed by " + address);
        buf.limit(buf.limit() + n);
        return buf;
    }

    @Override
    public synchronized void close() {
        broken = true;
        closeSocket();
    }

    private void closeSocket() {
        try {
            socket.close();
        } catch (IOException e) {
            log.warn("closing connection to {} failed", address, e);
        }
    }
}
