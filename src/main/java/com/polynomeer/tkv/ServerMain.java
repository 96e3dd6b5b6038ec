package com.polynomeer.tkv;

import com.polynomeer.tkv.cmd.CommandRegistry;
import com.polynomeer.tkv.db.MemoryDb;
import com.polynomeer.tkv.lua.LuaEngine;
import com.polynomeer.tkv.net.Reactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ServerMain {
    private static final Logger log = LoggerFactory.getLogger(ServerMain.class);

    public static void main(String[] args) throws Exception {
        if (ServerConfig.wantsHelp(args)) {
            System.out.println(ServerConfig.usage());
            return;
        }
        ServerConfig config;
        try {
            config = ServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(ServerConfig.usage());
            System.exit(1);
            return;
        }

        Reactor reactor = newReactor(config);
        Runtime.getRuntime().addShutdownHook(new Thread(reactor::stop, "reactor-shutdown"));
        log.info("Lua limits: {} ms, {} bytes, {} calls",
                config.luaTimeLimitMs(), config.luaMaxBytes(), config.luaMaxCalls());
        reactor.start(); // blocking loop
    }

    static Reactor newReactor(ServerConfig config) {
        MemoryDb db = new MemoryDb();
        LuaEngine lua = new LuaEngine(db, config.luaTimeLimitMs(), config.luaMaxBytes(), config.luaMaxCalls());
        return new Reactor(config.port(), new CommandRegistry(db, lua));
    }
}
