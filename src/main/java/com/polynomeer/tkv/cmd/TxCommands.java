package com.polynomeer.tkv.cmd;

import com.polynomeer.tkv.resp.RespWriter;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

/**
 * MULTI/EXEC/DISCARD transaction control.
 * - MULTI: begin queuing; subsequent commands return +QUEUED
 * - EXEC:  execute queued commands atomically; return RESP array of replies
 * - DISCARD: clear queue and exit transactional state
 */
public final class TxCommands {
    private TxCommands() {
    }

    public static void register(Map<String, Command> reg, CommandRegistry registry) {
        reg.put("MULTI", TxCommands::multi);
        reg.put("EXEC", (argv, s) -> exec(registry, argv, s));
        reg.put("DISCARD", TxCommands::discard);
    }

    public static boolean isTxControl(String name) {
        switch (name) {
            case "MULTI":
            case "EXEC":
            case "DISCARD":
                return true;
            default:
                return false;
        }
    }

    private static ByteBuffer multi(List<String> argv, Session session) {
        if (argv.size() != 1) return RespWriter.error("ERR wrong number of arguments for 'MULTI'");
        if (session.isInTxn()) return RespWriter.error("ERR MULTI calls can not be nested");
        session.beginTxn();
        return RespWriter.simpleString("OK");
    }

    private static ByteBuffer exec(CommandRegistry registry, List<String> argv, Session session) {
        if (argv.size() != 1) return RespWriter.error("ERR wrong number of arguments for 'EXEC'");
        return registry.execQueued(session);
    }

    private static ByteBuffer discard(List<String> argv, Session session) {
        if (argv.size() != 1) return RespWriter.error("ERR wrong number of arguments for 'DISCARD'");
        if (!session.isInTxn()) return RespWriter.error("ERR DISCARD without MULTI");
        session.endTxn();
        return RespWriter.simpleString("OK");
    }
}
