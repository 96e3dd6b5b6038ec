package com.polynomeer.tkv.lua;

import com.polynomeer.tkv.db.Db;
import com.polynomeer.tkv.db.WrongTypeException;
import com.polynomeer.tkv.resp.RespWriter;
import com.polynomeer.tkv.struct.ScoreRange;
import com.polynomeer.tkv.util.Clocks;
import com.polynomeer.tkv.util.Sha1;
import org.luaj.vm2.Globals;
import org.luaj.vm2.LoadState;
import org.luaj.vm2.LuaError;
import org.luaj.vm2.LuaFunction;
import org.luaj.vm2.LuaInteger;
import org.luaj.vm2.LuaString;
import org.luaj.vm2.LuaTable;
import org.luaj.vm2.LuaValue;
import org.luaj.vm2.Varargs;
import org.luaj.vm2.compiler.LuaC;
import org.luaj.vm2.lib.BaseLib;
import org.luaj.vm2.lib.MathLib;
import org.luaj.vm2.lib.PackageLib;
import org.luaj.vm2.lib.StringLib;
import org.luaj.vm2.lib.TableLib;
import org.luaj.vm2.lib.VarArgFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lua sandbox powered by luaj:
 * - Minimal libs: base, package, table, string, math (no io/os)
 * - Exposes table 'redis' with redis.call(...) and redis.pcall(...) over strings and sorted sets
 * - Cooperative time and resource limits enforced at each redis.call boundary
 * <p>
 * Not thread-safe; the command engine runs scripts under its monitor, which is what makes a
 * script atomic with respect to every other command.
 */
public final class LuaEngine {

    private static final Logger log = LoggerFactory.getLogger(LuaEngine.class);

    public static class NoScript extends RuntimeException {
        public NoScript(String sha) {
            super("No matching script: " + sha);
        }
    }

    public static class ScriptError extends RuntimeException {
        public ScriptError(String msg, Throwable cause) {
            super(msg, cause);
        }
    }

    private final Db db;

    // Limits
    private final long timeLimitMs;
    private final int maxBytes;    // total bytes across args to redis.call
    private final int maxCalls;    // total redis.call invocations per script

    private final Map<String, String> cache = new HashMap<>();

    public LuaEngine(Db db, long timeLimitMs, int maxBytes, int maxCalls) {
        this.db = db;
        this.timeLimitMs = timeLimitMs;
        this.maxBytes = maxBytes;
        this.maxCalls = maxCalls;
    }

    public LuaValue eval(String script, List<String> keys, List<String> args) {
        scriptLoad(script);
        return run(script, keys, args);
    }

    public LuaValue evalSha(String sha, List<String> keys, List<String> args) {
        String src = cache.get(sha.toLowerCase(Locale.ROOT));
        if (src == null) throw new NoScript(sha);
        return run(src, keys, args);
    }

    public String scriptLoad(String script) {
        String sha = Sha1.hex(script);
        cache.putIfAbsent(sha, script);
        return sha;
    }

    public boolean scriptExists(String sha) {
        return cache.containsKey(sha.toLowerCase(Locale.ROOT));
    }

    public void scriptFlush() {
        cache.clear();
    }

    private LuaValue run(String script, List<String> keys, List<String> args) {
        Globals g = makeGlobals();

        LuaTable keysTable = new LuaTable();
        for (int i = 0; i < keys.size(); i++) keysTable.set(i + 1, str(keys.get(i)));
        g.set("KEYS", keysTable);

        LuaTable argvTable = new LuaTable();
        for (int i = 0; i < args.size(); i++) argvTable.set(i + 1, str(args.get(i)));
        g.set("ARGV", argvTable);

        Limits limits = new Limits(Clocks.monoMillis(), timeLimitMs, maxBytes, maxCalls);
        LuaTable redis = new LuaTable();
        RedisCall call = new RedisCall(limits);
        redis.set("call", call);
        redis.set("pcall", new RedisPcall(call));
        g.set("redis", redis);

        try {
            LuaFunction fn = g.load(script, "script").checkfunction();
            return fn.invoke(LuaValue.NONE).arg1();
        } catch (LuaError e) {
            throw new ScriptError("Lua script execution failed: " + e.getMessage(), e);
        }
    }

    private Globals makeGlobals() {
        Globals g = new Globals();

        g.load(new BaseLib());
        g.load(new PackageLib());
        g.load(new StringLib());
        g.load(new TableLib());
        g.load(new MathLib());

        // compiler is needed to load script source at runtime
        LoadState.install(g);
        LuaC.install(g);

        return g;
    }

    // ---------- byte-exact conversions between keyspace strings and Lua strings ----------

    static LuaString str(String s) {
        return LuaString.valueOf(s.getBytes(RespWriter.CHARSET));
    }

    static byte[] bytes(LuaString s) {
        byte[] b = new byte[s.length()];
        s.copyInto(0, b, 0, b.length);
        return b;
    }

    private static String jstr(LuaValue v) {
        if (v.type() == LuaValue.TSTRING) return new String(bytes(v.checkstring()), RespWriter.CHARSET);
        if (v.type() == LuaValue.TNUMBER) return v.tojstring();
        throw new LuaError("Lua redis.call arguments must be strings or integers");
    }

    // Cooperative limits context
    private static final class Limits {
        final long startMs;
        final long maxMs;
        final int maxBytes;
        final int maxCalls;
        long usedBytes = 0;
        int usedCalls = 0;

        Limits(long startMs, long maxMs, int maxBytes, int maxCalls) {
            this.startMs = startMs;
            this.maxMs = maxMs;
            this.maxBytes = maxBytes;
            this.maxCalls = maxCalls;
        }

        void tick(List<String> argv) {
            if (Clocks.monoMillis() - startMs > maxMs) throw new LuaError("Lua script timed out");
            for (String s : argv) usedBytes += s.length();
            usedCalls++;
            if (usedBytes > maxBytes) throw new LuaError("Lua script exceeded call bytes limit");
            if (usedCalls > maxCalls) throw new LuaError("Lua script exceeded call count limit");
        }
    }

    // redis.pcall(...): command errors come back as { err = message } instead of raising
    private static final class RedisPcall extends VarArgFunction {
        private final RedisCall call;

        RedisPcall(RedisCall call) {
            this.call = call;
        }

        @Override
        public Varargs invoke(Varargs va) {
            try {
                return call.invoke(va);
            } catch (LuaError e) {
                LuaTable err = new LuaTable();
                err.set("err", LuaValue.valueOf(e.getMessage()));
                return err;
            }
        }
    }

    // redis.call(...)
    private final class RedisCall extends VarArgFunction {
        private final Limits lim;

        RedisCall(Limits lim) {
            this.lim = lim;
        }

        @Override
        public Varargs invoke(Varargs va) {
            List<String> argv = toArgv(va);
            if (argv.isEmpty()) throw new LuaError("Please specify at least one argument for redis.call()");
            lim.tick(argv);

            String cmd = argv.get(0).toUpperCase(Locale.ROOT);
            log.trace("redis.call {} ({} args)", cmd, argv.size() - 1);

            try {
                switch (cmd) {
                    case "GET":
                        arity(argv, 2, 2);
                        return v(db.getString(argv.get(1)));
                    case "SET":
                        arity(argv, 3, 3);
                        db.setString(argv.get(1), argv.get(2));
                        return LuaValue.valueOf("OK");
                    case "DEL":
                        arity(argv, 2, Integer.MAX_VALUE);
                        return LuaValue.valueOf(del(argv));
                    case "EXISTS":
                        arity(argv, 2, Integer.MAX_VALUE);
                        return LuaValue.valueOf(exists(argv));
                    case "MGET":
                        arity(argv, 2, Integer.MAX_VALUE);
                        return mget(argv);
                    case "ZADD":
                        arity(argv, 4, 4);
                        return LuaValue.valueOf(db.zadd(argv.get(1), ScoreRange.parseScore(argv.get(2)), argv.get(3)));
                    case "ZREM":
                        arity(argv, 3, Integer.MAX_VALUE);
                        return LuaValue.valueOf(db.zrem(argv.get(1), argv.subList(2, argv.size())));
                    case "ZSCORE":
                        arity(argv, 3, 3);
                        Double score = db.zscore(argv.get(1), argv.get(2));
                        return score == null ? LuaValue.FALSE : LuaValue.valueOf(ScoreRange.format(score));
                    case "ZCOUNT":
                        arity(argv, 4, 4);
                        return LuaInteger.valueOf(db.zcount(argv.get(1), ScoreRange.parse(argv.get(2), argv.get(3))));
                    case "ZRANGE":
                        return zrange(argv);
                    case "ZRANGEBYSCORE":
                        return zrangeByScore(argv);
                    default:
                        throw new LuaError("Unknown Redis command called from Lua script: " + cmd);
                }
            } catch (WrongTypeException e) {
                throw new LuaError(e.getMessage());
            } catch (IllegalArgumentException e) {
                throw new LuaError("ERR " + e.getMessage());
            }
        }

        private void arity(List<String> a, int min, int max) {
            if (a.size() < min || a.size() > max) {
                throw new LuaError("wrong number of arguments for '" + a.get(0) + "'");
            }
        }

        private int del(List<String> a) {
            int n = 0;
            for (int i = 1; i < a.size(); i++) if (db.del(a.get(i))) n++;
            return n;
        }

        private int exists(List<String> a) {
            int n = 0;
            for (int i = 1; i < a.size(); i++) if (db.exists(a.get(i))) n++;
            return n;
        }

        private LuaValue mget(List<String> a) {
            LuaTable t = new LuaTable();
            for (int i = 1; i < a.size(); i++) {
                String val;
                try {
                    val = db.getString(a.get(i));
                } catch (WrongTypeException e) {
                    val = null; // MGET reports non-strings as nil
                }
                t.set(i, v(val));
            }
            return t;
        }

        // ZRANGE key min max BYSCORE [LIMIT offset count]
        private LuaValue zrange(List<String> a) {
            if (a.size() < 5 || !"BYSCORE".equalsIgnoreCase(a.get(4))) {
                throw new LuaError("ZRANGE is only supported with BYSCORE");
            }
            return members(a, 5);
        }

        // ZRANGEBYSCORE key min max [LIMIT offset count]
        private LuaValue zrangeByScore(List<String> a) {
            if (a.size() < 4) throw new LuaError("wrong number of arguments for 'ZRANGEBYSCORE'");
            return members(a, 4);
        }

        private LuaValue members(List<String> a, int limitAt) {
            long offset = 0;
            long count = -1;
            if (a.size() == limitAt + 3 && "LIMIT".equalsIgnoreCase(a.get(limitAt))) {
                offset = Long.parseLong(a.get(limitAt + 1));
                count = Long.parseLong(a.get(limitAt + 2));
            } else if (a.size() != limitAt) {
                throw new LuaError("syntax error");
            }
            List<String> out = db.zrangeByScore(a.get(1), ScoreRange.parse(a.get(2), a.get(3)), offset, count);
            LuaTable t = new LuaTable();
            for (int i = 0; i < out.size(); i++) t.set(i + 1, str(out.get(i)));
            return t;
        }

        private List<String> toArgv(Varargs va) {
            int n = va.narg();
            List<String> out = new ArrayList<>(n);
            for (int i = 1; i <= n; i++) out.add(jstr(va.arg(i)));
            return out;
        }

        // Redis converts nil bulk replies to Lua false
        private LuaValue v(String s) {
            return (s == null) ? LuaValue.FALSE : str(s);
        }
    }
}
