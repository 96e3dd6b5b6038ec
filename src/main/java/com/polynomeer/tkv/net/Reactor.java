package com.polynomeer.tkv.net;

import com.polynomeer.tkv.cmd.CommandRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Iterator;

/**
 * Single-threaded Reactor using Selector.
 * Every command from every connection is dispatched on the loop thread.
 */
public class Reactor {
    private static final Logger log = LoggerFactory.getLogger(Reactor.class);

    private static final long SELECT_TIMEOUT_MS = 1000;

    private final int port;
    private final CommandRegistry registry;
    private Selector selector;
    private ServerSocketChannel server;
    private volatile boolean running;

    /**
     * @param port TCP port to listen on; 0 picks an ephemeral port (see {@link #boundPort()})
     */
    public Reactor(int port, CommandRegistry registry) {
        this.port = port;
        this.registry = registry;
    }

    /**
     * Opens the selector and binds the listening socket. Returns the bound port.
     */
    public int bind() throws IOException {
        selector = Selector.open();

        server = ServerSocketChannel.open();
        server.configureBlocking(false);
        server.bind(new InetSocketAddress(port));
        server.register(selector, SelectionKey.OP_ACCEPT);
        running = true;

        log.info("Listening on port {}", boundPort());
        return boundPort();
    }

    public int boundPort() {
        return server.socket().getLocalPort();
    }

    /**
     * Blocking event loop; returns after {@link #stop()}.
     */
    public void run() throws IOException {
        try {
            while (running) {
                selector.select(SELECT_TIMEOUT_MS);

                Iterator<SelectionKey> it = selector.selectedKeys().iterator();
                while (it.hasNext()) {
                    SelectionKey key = it.next();
                    it.remove();

                    if (!key.isValid()) continue;

                    try {
                        if (key.isAcceptable()) {
                            handleAccept();
                            continue;
                        }
                        if (key.isReadable()) {
                            ((ClientConn) key.attachment()).handleRead();
                        }
                        if (key.isValid() && key.isWritable()) {
                            ((ClientConn) key.attachment()).handleWrite();
                        }
                    } catch (IOException e) {
                        log.debug("connection dropped: {}", e.getMessage());
                        Object att = key.attachment();
                        if (att instanceof ClientConn) {
                            ((ClientConn) att).close();
                        }
                        key.cancel();
                    }
                }
            }
        } finally {
            closeAll();
        }
    }

    public void start() throws IOException {
        bind();
        run();
    }

    public void stop() {
        running = false;
        if (selector != null) selector.wakeup();
    }

    private void handleAccept() throws IOException {
        SocketChannel ch = server.accept();
        if (ch == null) return;
        ch.configureBlocking(false);
        ClientConn conn = new ClientConn(ch, selector, registry);
        ch.register(selector, SelectionKey.OP_READ, conn);
        log.debug("Accepted {}", ch.getRemoteAddress());
    }

    private void closeAll() throws IOException {
        for (SelectionKey key : selector.keys()) {
            if (key.attachment() instanceof ClientConn) {
                ((ClientConn) key.attachment()).close();
            }
        }
        server.close();
        selector.close();
        log.info("Stopped listening on port {}", port);
    }
}
