package com.polynomeer.tkv.cmd;

import com.polynomeer.tkv.resp.RespWriter;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

public final class PingCommands {
    private PingCommands() {
    }

    public static void register(Map<String, Command> reg) {
        reg.put("PING", PingCommands::ping);
    }

    private static ByteBuffer ping(List<String> argv, Session session) {
        if (argv.size() == 1) return RespWriter.simpleString("PONG");
        if (argv.size() == 2) return RespWriter.bulkString(argv.get(1));
        return RespWriter.error("ERR wrong number of arguments for 'PING'");
    }
}
