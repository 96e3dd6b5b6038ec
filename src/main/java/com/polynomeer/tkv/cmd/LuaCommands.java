package com.polynomeer.tkv.cmd;

import com.polynomeer.tkv.lua.LuaEngine;
import com.polynomeer.tkv.lua.LuaRespEncoder;
import com.polynomeer.tkv.resp.RespWriter;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lua scripting commands:
 * - EVAL script numkeys key [key ...] arg [arg ...]
 * - EVALSHA sha1 numkeys key [key ...] arg [arg ...]
 * - SCRIPT LOAD script
 * - SCRIPT EXISTS sha1 [sha1 ...]
 * - SCRIPT FLUSH
 */
public final class LuaCommands {
    private LuaCommands() {
    }

    public static void register(Map<String, Command> reg, LuaEngine lua) {
        reg.put("EVAL", (argv, s) -> eval(lua, argv, false));
        reg.put("EVALSHA", (argv, s) -> eval(lua, argv, true));
        reg.put("SCRIPT", (argv, s) -> script(lua, argv));
    }

    private static ByteBuffer eval(LuaEngine lua, List<String> argv, boolean bySha) {
        String name = bySha ? "EVALSHA" : "EVAL";
        if (argv.size() < 3) return RespWriter.error("ERR wrong number of arguments for '" + name + "'");
        int numkeys;
        try {
            numkeys = Integer.parseInt(argv.get(2));
        } catch (NumberFormatException e) {
            return RespWriter.error("ERR value is not an integer or out of range");
        }
        if (numkeys < 0) return RespWriter.error("ERR Number of keys can't be negative");
        if (argv.size() < 3 + numkeys) return RespWriter.error("ERR Number of keys can't be greater than number of args");

        List<String> keys = new ArrayList<>(argv.subList(3, 3 + numkeys));
        List<String> args = new ArrayList<>(argv.subList(3 + numkeys, argv.size()));

        try {
            var luaVal = bySha
                    ? lua.evalSha(argv.get(1), keys, args)
                    : lua.eval(argv.get(1), keys, args);
            return LuaRespEncoder.encode(luaVal);
        } catch (LuaEngine.NoScript e) {
            return RespWriter.error("NOSCRIPT No matching script. Please use EVAL.");
        } catch (LuaEngine.ScriptError e) {
            return RespWriter.error("ERR " + e.getMessage());
        }
    }

    private static ByteBuffer script(LuaEngine lua, List<String> argv) {
        if (argv.size() < 2) return RespWriter.error("ERR wrong number of arguments for 'SCRIPT'");
        String sub = argv.get(1).toUpperCase(Locale.ROOT);
        switch (sub) {
            case "LOAD":
                if (argv.size() != 3) return RespWriter.error("ERR wrong number of arguments for 'SCRIPT LOAD'");
                return RespWriter.bulkString(lua.scriptLoad(argv.get(2)));
            case "EXISTS":
                if (argv.size() < 3) return RespWriter.error("ERR wrong number of arguments for 'SCRIPT EXISTS'");
                int[] arr = new int[argv.size() - 2];
                for (int i = 2; i < argv.size(); i++) arr[i - 2] = lua.scriptExists(argv.get(i)) ? 1 : 0;
                return RespWriter.arrayOfIntegers(arr);
            case "FLUSH":
                lua.scriptFlush();
                return RespWriter.simpleString("OK");
            default:
                return RespWriter.error("ERR unknown subcommand or wrong number of arguments for 'SCRIPT'");
        }
    }
}
