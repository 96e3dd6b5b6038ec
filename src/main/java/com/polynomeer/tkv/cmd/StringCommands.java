package com.polynomeer.tkv.cmd;

import com.polynomeer.tkv.db.Db;
import com.polynomeer.tkv.db.WrongTypeException;
import com.polynomeer.tkv.resp.RespWriter;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * GET / SET / DEL / EXISTS / MGET.
 */
public final class StringCommands {
    private StringCommands() {
    }

    public static void register(Map<String, Command> reg, Db db) {
        reg.put("GET", (argv, s) -> get(db, argv));
        reg.put("SET", (argv, s) -> set(db, argv));
        reg.put("DEL", (argv, s) -> del(db, argv));
        reg.put("EXISTS", (argv, s) -> exists(db, argv));
        reg.put("MGET", (argv, s) -> mget(db, argv));
    }

    private static ByteBuffer get(Db db, List<String> argv) {
        if (argv.size() != 2) return RespWriter.error("ERR wrong number of arguments for 'GET'");
        try {
            return RespWriter.bulkString(db.getString(argv.get(1)));
        } catch (WrongTypeException e) {
            return RespWriter.error(e.getMessage());
        }
    }

    private static ByteBuffer set(Db db, List<String> argv) {
        if (argv.size() < 3) return RespWriter.error("ERR wrong number of arguments for 'SET'");
        // no expiry or conditional options in this keyspace
        if (argv.size() > 3) return RespWriter.error("ERR syntax error");
        db.setString(argv.get(1), argv.get(2));
        return RespWriter.simpleString("OK");
    }

    private static ByteBuffer del(Db db, List<String> argv) {
        if (argv.size() < 2) return RespWriter.error("ERR wrong number of arguments for 'DEL'");
        long deleted = 0;
        for (int i = 1; i < argv.size(); i++) {
            if (db.del(argv.get(i))) deleted++;
        }
        return RespWriter.integer(deleted);
    }

    private static ByteBuffer exists(Db db, List<String> argv) {
        if (argv.size() < 2) return RespWriter.error("ERR wrong number of arguments for 'EXISTS'");
        long n = 0;
        for (int i = 1; i < argv.size(); i++) {
            if (db.exists(argv.get(i))) n++;
        }
        return RespWriter.integer(n);
    }

    private static ByteBuffer mget(Db db, List<String> argv) {
        if (argv.size() < 2) return RespWriter.error("ERR wrong number of arguments for 'MGET'");
        List<String> values = new ArrayList<>(argv.size() - 1);
        for (int i = 1; i < argv.size(); i++) {
            try {
                values.add(db.getString(argv.get(i)));
            } catch (WrongTypeException e) {
                values.add(null); // MGET reports non-strings as nil
            }
        }
        return RespWriter.arrayOfBulk(values);
    }
}
