package com.polynomeer.tkv.net;

import com.polynomeer.tkv.cmd.CommandRegistry;
import com.polynomeer.tkv.cmd.Session;
import com.polynomeer.tkv.resp.RespError;
import com.polynomeer.tkv.resp.RespReader;
import com.polynomeer.tkv.resp.RespWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Per-connection state:
 * - read buffer, write queue, command session (MULTI state)
 * OP_READ: parse RESP command frames (pipelined) → dispatch → enqueue replies
 * OP_WRITE: flush write queue (partial writes)
 */
public class ClientConn {
    private static final Logger log = LoggerFactory.getLogger(ClientConn.class);

    private static final int READ_BUF_SIZE = 64 * 1024;

    private final SocketChannel ch;
    private final Selector selector;
    private final CommandRegistry registry;
    private final Session session = new Session();

    private ByteBuffer readBuf = ByteBuffer.allocate(READ_BUF_SIZE);
    private final Deque<ByteBuffer> writeQueue = new ArrayDeque<>();
    private final RespReader respReader = new RespReader();
    private boolean closeAfterFlush;

    public ClientConn(SocketChannel ch, Selector selector, CommandRegistry registry) {
        this.ch = ch;
        this.selector = selector;
        this.registry = registry;
    }

    /**
     * Handle readable event: read → parse → execute → queue responses
     */
    public void handleRead() throws IOException {
        if (!readBuf.hasRemaining()) {
            // a single frame is larger than the buffer; grow it
            ByteBuffer bigger = ByteBuffer.allocate(readBuf.capacity() * 2);
            readBuf.flip();
            bigger.put(readBuf);
            readBuf = bigger;
        }
        int n = ch.read(readBuf);
        if (n == -1) {
            close();
            return;
        }
        if (n == 0) return;

        readBuf.flip();

        while (!closeAfterFlush) {
            int markPos = readBuf.position();
            List<String> argv;
            try {
                argv = respReader.tryReadCommand(readBuf);
            } catch (RespError e) {
                log.debug("protocol error from {}: {}", ch.getRemoteAddress(), e.getMessage());
                enqueue(RespWriter.error("ERR " + e.getMessage()));
                closeAfterFlush = true;
                break;
            }
            if (argv == null) {
                readBuf.position(markPos);
                break;
            }
            enqueue(registry.dispatch(argv, session));
        }

        readBuf.compact();

        if (!writeQueue.isEmpty()) {
            interestWrite(true);
        }
    }

    /**
     * Handle writable event: flush write queue with partial-write care
     */
    public void handleWrite() throws IOException {
        while (!writeQueue.isEmpty()) {
            ByteBuffer buf = writeQueue.peekFirst();
            ch.write(buf);
            if (buf.hasRemaining()) {
                break;
            }
            writeQueue.pollFirst();
        }
        if (writeQueue.isEmpty()) {
            if (closeAfterFlush) {
                close();
                return;
            }
            interestWrite(false);
        }
    }

    private void interestWrite(boolean on) {
        SelectionKey key = ch.keyFor(selector);
        if (key != null && key.isValid()) {
            key.interestOps(on ? key.interestOps() | SelectionKey.OP_WRITE : key.interestOps() & ~SelectionKey.OP_WRITE);
        }
    }

    private void enqueue(ByteBuffer response) {
        writeQueue.addLast(response);
    }

    public void close() {
        try {
            ch.close();
        } catch (IOException e) {
            log.debug("closing client channel failed", e);
        }
    }
}
