package com.polynomeer.tkv.lua;

import org.luaj.vm2.LuaString;
import org.luaj.vm2.LuaTable;
import org.luaj.vm2.LuaValue;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Encodes a LuaValue into RESP:
 * - nil / false   -> $-1
 * - true          -> :1
 * - number        -> :<int>  (floats truncated)
 * - string        -> $<len>\r\n...\r\n  (raw bytes)
 * - { err = msg } -> -msg      (what redis.pcall returns on failure)
 * - { ok = msg }  -> +msg
 * - table (array) -> *N + elements (1..N); non-integer keys ignored
 */
public final class LuaRespEncoder {
    private LuaRespEncoder() {
    }

    public static ByteBuffer encode(LuaValue v) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(256);
        write(out, v);
        return ByteBuffer.wrap(out.toByteArray());
    }

    private static void write(ByteArrayOutputStream out, LuaValue v) {
        if (v.isnil() || (v.isboolean() && !v.toboolean())) {
            ascii(out, "$-1\r\n");
        } else if (v.isboolean()) {
            ascii(out, ":1\r\n");
        } else if (v.type() == LuaValue.TNUMBER) {
            ascii(out, ":" + v.tolong() + "\r\n");
        } else if (v.type() == LuaValue.TSTRING) {
            bulk(out, LuaEngine.bytes(v.checkstring()));
        } else if (v.istable() && v.get("err").isstring()) {
            ascii(out, "-" + v.get("err").tojstring().replace('\r', ' ').replace('\n', ' ') + "\r\n");
        } else if (v.istable() && v.get("ok").isstring()) {
            ascii(out, "+" + v.get("ok").tojstring() + "\r\n");
        } else if (v.istable()) {
            LuaTable t = v.checktable();
            int n = t.length();
            ascii(out, "*" + n + "\r\n");
            for (int i = 1; i <= n; i++) {
                write(out, t.get(i));
            }
        } else {
            // functions, userdata: encode tostring()
            bulk(out, LuaEngine.bytes(LuaString.valueOf(v.tojstring())));
        }
    }

    private static void bulk(ByteArrayOutputStream out, byte[] b) {
        ascii(out, "$" + b.length + "\r\n");
        out.writeBytes(b);
        ascii(out, "\r\n");
    }

    private static void ascii(ByteArrayOutputStream out, String s) {
        out.writeBytes(s.getBytes(StandardCharsets.US_ASCII));
    }
}
