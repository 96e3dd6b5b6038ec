package com.polynomeer.tkv.cmd;

import com.polynomeer.tkv.db.MemoryDb;
import com.polynomeer.tkv.lua.LuaEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CommandRegistryTest {

    private MemoryDb db;
    private CommandRegistry registry;
    private Session session;

    @BeforeEach
    void setUp() {
        db = new MemoryDb();
        registry = new CommandRegistry(db, new LuaEngine(db, 5_000, 64 * 1024 * 1024, 10_000));
        session = new Session();
    }

    private String run(String... argv) {
        ByteBuffer reply = registry.dispatch(Arrays.asList(argv), session);
        byte[] out = new byte[reply.remaining()];
        reply.get(out);
        return new String(out, StandardCharsets.ISO_8859_1);
    }

    @Test
    void ping_and_unknown_commands() {
        assertEquals("+PONG\r\n", run("PING"));
        assertEquals("-ERR unknown command 'HSET'\r\n", run("HSET", "h", "f", "v"));
    }

    @Test
    void string_commands() {
        assertEquals("$-1\r\n", run("GET", "k"));
        assertEquals("+OK\r\n", run("SET", "k", "v"));
        assertEquals("$1\r\nv\r\n", run("get", "k"));
        assertEquals(":1\r\n", run("EXISTS", "k"));
        assertEquals("*2\r\n$1\r\nv\r\n$-1\r\n", run("MGET", "k", "missing"));
        assertEquals(":1\r\n", run("DEL", "k", "missing"));
        assertEquals(":0\r\n", run("EXISTS", "k"));
        assertEquals("-ERR syntax error\r\n", run("SET", "k", "v", "EX", "10"));
    }

    @Test
    void sorted_set_commands() {
        assertEquals(":1\r\n", run("ZADD", "z", "10", "a"));
        assertEquals(":0\r\n", run("ZADD", "z", "15", "a"));
        assertEquals(":1\r\n", run("ZADD", "z", "20", "b"));
        assertEquals(":1\r\n", run("ZADD", "z", "30", "c"));

        assertEquals("$2\r\n15\r\n", run("ZSCORE", "z", "a"));
        assertEquals(":2\r\n", run("ZCOUNT", "z", "(15", "+inf"));
        assertEquals("*2\r\n$1\r\nb\r\n$1\r\nc\r\n", run("ZRANGEBYSCORE", "z", "16", "+inf"));
        assertEquals("*1\r\n$1\r\nb\r\n", run("ZRANGE", "z", "-inf", "+inf", "BYSCORE", "LIMIT", "1", "1"));
        assertEquals(":1\r\n", run("ZREM", "z", "a", "nope"));
        assertEquals("$-1\r\n", run("ZSCORE", "z", "a"));
        assertEquals("-ERR min or max is not a float\r\n", run("ZCOUNT", "z", "x", "1"));
    }

    @Test
    void wrong_type_is_reported() {
        run("SET", "s", "v");
        assertTrue(run("ZADD", "s", "1", "m").startsWith("-WRONGTYPE"));

        run("ZADD", "z", "1", "m");
        assertTrue(run("GET", "z").startsWith("-WRONGTYPE"));
        assertEquals("*2\r\n$1\r\nv\r\n$-1\r\n", run("MGET", "s", "z"));
    }

    @Test
    void multi_exec_runs_queued_commands_in_order() {
        assertEquals("+OK\r\n", run("MULTI"));
        assertEquals("+QUEUED\r\n", run("SET", "k", "v"));
        assertEquals("+QUEUED\r\n", run("ZADD", "idx", "1", "k"));
        assertEquals("+QUEUED\r\n", run("GET", "k"));

        assertEquals("*3\r\n+OK\r\n:1\r\n$1\r\nv\r\n", run("EXEC"));
        assertFalse(session.isInTxn());
        assertEquals("v", db.getString("k"));
    }

    @Test
    void unknown_command_aborts_the_transaction() {
        run("MULTI");
        run("SET", "k", "v");
        run("NOPE");

        assertTrue(run("EXEC").startsWith("-EXECABORT"));
        assertNull(db.getString("k"));
    }

    @Test
    void transaction_control_errors() {
        assertEquals("-ERR EXEC without MULTI\r\n", run("EXEC"));
        assertEquals("-ERR DISCARD without MULTI\r\n", run("DISCARD"));
        run("MULTI");
        assertEquals("-ERR MULTI calls can not be nested\r\n", run("MULTI"));
        run("SET", "k", "v");
        assertEquals("+OK\r\n", run("DISCARD"));
        assertNull(db.getString("k"));
    }

    @Test
    void scripting_commands() {
        String loaded = run("SCRIPT", "LOAD", "return ARGV[1]");
        String sha = loaded.substring(loaded.indexOf('\n') + 1, loaded.length() - 2);

        assertEquals("$2\r\nhi\r\n", run("EVALSHA", sha, "0", "hi"));
        assertEquals("*2\r\n:1\r\n:0\r\n", run("SCRIPT", "EXISTS", sha, "0000"));
        assertEquals(":7\r\n", run("EVAL", "return 7", "0"));

        assertEquals("+OK\r\n", run("SCRIPT", "FLUSH"));
        assertEquals("-NOSCRIPT No matching script. Please use EVAL.\r\n", run("EVALSHA", sha, "0", "hi"));
        assertEquals("-ERR Number of keys can't be greater than number of args\r\n", run("EVAL", "return 1", "2", "k"));
    }
}
