package com.polynomeer.tkv.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-1 hex helper for SCRIPT cache keys.
 * <p>
 * Script text arrives as one char per byte, so it is hashed as ISO-8859-1 to digest the bytes
 * the client sent.
 */
public final class Sha1 {
    private Sha1() {
    }

    public static String hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            byte[] d = md.digest(s.getBytes(StandardCharsets.ISO_8859_1));
            StringBuilder sb = new StringBuilder(d.length * 2);
            for (byte b : d) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-1
            throw new IllegalStateException(e);
        }
    }
}
