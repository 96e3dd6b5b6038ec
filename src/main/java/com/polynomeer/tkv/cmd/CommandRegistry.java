package com.polynomeer.tkv.cmd;

import com.polynomeer.tkv.db.Db;
import com.polynomeer.tkv.lua.LuaEngine;
import com.polynomeer.tkv.resp.RespWriter;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command dispatcher over one keyspace.
 * <p>
 * {@link #dispatch} holds this registry's monitor for the whole command, so EXEC (every queued
 * command) and EVAL/EVALSHA (every redis.call of the script) are atomic with respect to other
 * callers, whether those are reactor connections or in-process clients.
 */
public final class CommandRegistry {
    private final Map<String, Command> cmds = new HashMap<>();

    public CommandRegistry(Db db, LuaEngine lua) {
        PingCommands.register(cmds);
        StringCommands.register(cmds, db);      // GET/SET/DEL/EXISTS/MGET
        SortedSetCommands.register(cmds, db);   // Z*
        TxCommands.register(cmds, this);        // MULTI/EXEC/DISCARD
        LuaCommands.register(cmds, lua);        // EVAL/EVALSHA/SCRIPT
    }

    /**
     * Normal dispatch path. Handles transactional queuing.
     */
    public synchronized ByteBuffer dispatch(List<String> argv, Session session) {
        if (argv.isEmpty()) return RespWriter.error("ERR empty command");
        String name = argv.get(0).toUpperCase(Locale.ROOT);

        Command c = cmds.get(name);
        if (c == null) {
            if (session.isInTxn()) {
                // unknown command during MULTI poisons the transaction
                session.markTxnDirty();
            }
            return RespWriter.error("ERR unknown command '" + argv.get(0) + "'");
        }

        // MULTI/EXEC/DISCARD are handled always (even inside MULTI)
        if (TxCommands.isTxControl(name)) {
            return c.execute(argv, session);
        }

        if (session.isInTxn() && !session.isBypassTxn()) {
            session.queueTxn(argv);
            return RespWriter.simpleString("QUEUED");
        }

        return c.execute(argv, session);
    }

    /**
     * EXEC implementation. Runs queued commands and returns an array of their replies.
     * Called from within {@link #dispatch}, so the monitor is already held.
     */
    ByteBuffer execQueued(Session session) {
        if (!session.isInTxn()) return RespWriter.error("ERR EXEC without MULTI");
        if (session.isTxnDirty()) {
            session.endTxn();
            return RespWriter.error("EXECABORT Transaction discarded because of previous errors.");
        }
        List<List<String>> queued = session.drainTxnQueue();
        List<ByteBuffer> replies = new ArrayList<>(queued.size());
        session.setBypassTxn(true);
        try {
            for (List<String> a : queued) {
                replies.add(dispatch(a, session));
            }
        } finally {
            session.setBypassTxn(false);
            session.endTxn();
        }
        return RespWriter.arrayOfFrames(replies);
    }
}
