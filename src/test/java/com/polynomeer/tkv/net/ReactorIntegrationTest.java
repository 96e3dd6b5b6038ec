package com.polynomeer.tkv.net;

import com.polynomeer.tkv.BulkSetRecord;
import com.polynomeer.tkv.KeyComposer;
import com.polynomeer.tkv.Page;
import com.polynomeer.tkv.PageItem;
import com.polynomeer.tkv.Paginator;
import com.polynomeer.tkv.TimeKeyValueStore;
import com.polynomeer.tkv.client.RespStoreClient;
import com.polynomeer.tkv.client.StoreClientException;
import com.polynomeer.tkv.cmd.CommandRegistry;
import com.polynomeer.tkv.db.MemoryDb;
import com.polynomeer.tkv.lua.LuaEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Store and client against a live reactor on an ephemeral port.
 */
class ReactorIntegrationTest {

    private static final Instant BASE = Instant.parse("2025-01-01T00:00:00Z");

    private Reactor reactor;
    private Thread loop;
    private RespStoreClient client;
    private TimeKeyValueStore store;

    @BeforeEach
    void setUp() throws IOException {
        MemoryDb db = new MemoryDb();
        reactor = new Reactor(0, new CommandRegistry(db, new LuaEngine(db, 5_000, 64 * 1024 * 1024, 10_000)));
        int port = reactor.bind();
        loop = new Thread(() -> {
            try {
                reactor.run();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, "reactor-test");
        loop.start();

        client = RespStoreClient.connect("127.0.0.1", port, Duration.ofSeconds(5));
        store = new TimeKeyValueStore(KeyComposer.DELIM_UNIT, "it", client);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        client.close();
        reactor.stop();
        loop.join(5_000);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void ping() {
        assertEquals("PONG", client.ping());
    }

    @Test
    void crud_over_the_wire() {
        assertFalse(store.set(bytes("one"), BASE, "user", "1"));
        assertTrue(store.set(bytes("uno"), BASE.plusSeconds(1), "user", "1"));

        assertTrue(store.exists("user", "1"));
        assertArrayEquals(bytes("uno"), store.get("user", "1").orElseThrow());
        assertEquals(BASE.plusSeconds(1), store.lastModified("user", "1").orElseThrow());

        store.delete("user", "1");
        assertFalse(store.exists("user", "1"));
        assertEquals(0, store.fetchPage(null, null, 0, 10).total());
    }

    @Test
    void bulk_insert_and_paginate() {
        List<BulkSetRecord> records = new ArrayList<>();
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            records.add(new BulkSetRecord(bytes("v" + i), BASE.plusSeconds(i), "event", Integer.toString(i)));
            expected.add("v" + i);
        }
        store.bulkSet(records);

        List<String> seen = new ArrayList<>();
        var it = Paginator.paginate(store::fetchPageConsistent, BASE, BASE.plusSeconds(60), 0, 10);
        while (it.hasNext()) {
            PageItem item = it.next();
            seen.add(new String(item.payload().toByteArray(), StandardCharsets.UTF_8));
        }
        assertEquals(expected, seen);

        Page page = store.fetchPage(BASE.plusSeconds(5), BASE.plusSeconds(9), 2, 10);
        assertEquals(5, page.total());
        assertEquals(3, page.size());
    }

    @Test
    void binary_payloads_over_the_wire() {
        byte[] data = new byte[1024];
        for (int i = 0; i < data.length; i++) data[i] = (byte) (i * 31);
        data[10] = '\r';
        data[11] = '\n';

        store.set(data, BASE, "blob");

        assertArrayEquals(data, store.get("blob").orElseThrow());
        assertArrayEquals(data, store.fetchPageConsistent(null, null, 0, 1).iterator().next().payload().toByteArray());
    }

    @Test
    void closed_client_fails_fast() {
        client.close();
        assertThrows(StoreClientException.class, () -> client.ping());
    }
}
