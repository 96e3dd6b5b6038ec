package com.polynomeer.tkv;

/**
 * Server settings parsed from CLI args.
 *
 * Supported flags (all optional):
 *   --port, -p            <port>   listen port (default 6379; 0 for ephemeral)
 *   --lua-time-limit-ms   <ms>     wall time a script may run (default 5000)
 *   --lua-max-bytes       <bytes>  total argument bytes a script may pass to redis.call (default 64 MiB)
 *   --lua-max-calls       <n>      redis.call invocations per script (default 10000)
 *   --help, -h
 */
public final class ServerConfig {
    public static final int DEFAULT_PORT = 6379;
    public static final long DEFAULT_LUA_TIME_LIMIT_MS = 5000;
    public static final int DEFAULT_LUA_MAX_BYTES = 64 * 1024 * 1024;
    public static final int DEFAULT_LUA_MAX_CALLS = 10_000;

    private final int port;
    private final long luaTimeLimitMs;
    private final int luaMaxBytes;
    private final int luaMaxCalls;

    public ServerConfig(int port, long luaTimeLimitMs, int luaMaxBytes, int luaMaxCalls) {
        this.port = port;
        this.luaTimeLimitMs = luaTimeLimitMs;
        this.luaMaxBytes = luaMaxBytes;
        this.luaMaxCalls = luaMaxCalls;
    }

    /**
     * @throws IllegalArgumentException on an unknown flag, a missing value or a malformed number
     */
    public static ServerConfig fromArgs(String[] args) {
        int port = DEFAULT_PORT;
        long timeLimit = DEFAULT_LUA_TIME_LIMIT_MS;
        int maxBytes = DEFAULT_LUA_MAX_BYTES;
        int maxCalls = DEFAULT_LUA_MAX_CALLS;

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            switch (flag) {
                case "--port":
                case "-p":
                    port = parseInt(flag, value(args, i++));
                    if (port < 0 || port > 65535) throw new IllegalArgumentException("Invalid port: " + port);
                    break;
                case "--lua-time-limit-ms":
                    timeLimit = parsePositive(flag, value(args, i++));
                    break;
                case "--lua-max-bytes":
                    maxBytes = (int) Math.min(Integer.MAX_VALUE, parsePositive(flag, value(args, i++)));
                    break;
                case "--lua-max-calls":
                    maxCalls = (int) Math.min(Integer.MAX_VALUE, parsePositive(flag, value(args, i++)));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown argument: " + flag);
            }
        }
        return new ServerConfig(port, timeLimit, maxBytes, maxCalls);
    }

    public static boolean wantsHelp(String[] args) {
        for (String a : args) {
            if ("--help".equals(a) || "-h".equals(a)) return true;
        }
        return false;
    }

    public static String usage() {
        return String.join("\n",
                "Usage: redis-tkv [options]",
                "  --port, -p <port>           listen port (default " + DEFAULT_PORT + ")",
                "  --lua-time-limit-ms <ms>    script wall time limit (default " + DEFAULT_LUA_TIME_LIMIT_MS + ")",
                "  --lua-max-bytes <bytes>     redis.call argument bytes per script (default " + DEFAULT_LUA_MAX_BYTES + ")",
                "  --lua-max-calls <n>         redis.call invocations per script (default " + DEFAULT_LUA_MAX_CALLS + ")",
                "  --help, -h");
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) throw new IllegalArgumentException("Missing value for " + args[i]);
        return args[i + 1];
    }

    private static int parseInt(String flag, String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag + ": " + s, e);
        }
    }

    private static long parsePositive(String flag, String s) {
        long v;
        try {
            v = Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag + ": " + s, e);
        }
        if (v <= 0) throw new IllegalArgumentException("Invalid " + flag + ": " + s);
        return v;
    }

    public int port() {
        return port;
    }

    public long luaTimeLimitMs() {
        return luaTimeLimitMs;
    }

    public int luaMaxBytes() {
        return luaMaxBytes;
    }

    public int luaMaxCalls() {
        return luaMaxCalls;
    }
}
