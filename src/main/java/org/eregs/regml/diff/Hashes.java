package org.eregs.regml.diff;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** SHA-256 helpers for node content hashes. */
public final class Hashes {

    public static final String HASH_ALGO = "SHA-256";

    private Hashes() {}

    public static byte[] sha256(byte[]... chunks) {
        try {
            MessageDigest md = MessageDigest.getInstance(HASH_ALGO);
            for (byte[] c : chunks) md.update(c);
            return md.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(HASH_ALGO + " unavailable", e);
        }
    }

    public static byte[] sha256(String s) {
        return sha256(s.getBytes(StandardCharsets.UTF_8));
    }

    public static String hex(byte[] x) {
        StringBuilder sb = new StringBuilder(x.length * 2);
        for (byte b : x) sb.append(String.format("%02x", b));
        return sb.toString();
    }
}
