package io.serveritems.core;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * MD5 digests used for sprite identity.
 */
public final class ContentHash {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private ContentHash() {
    }

    /**
     * Returns the 16-byte MD5 digest of {@code data}.
     */
    public static byte[] md5(byte[] data) {
        Objects.requireNonNull(data, "data");
        return newMd5().digest(data);
    }

    /**
     * Returns a fresh MD5 digest for incremental hashing.
     */
    public static MessageDigest newMd5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship MD5
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    public static String md5Hex(byte[] data) {
        return toHex(md5(data));
    }

    public static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            out[i * 2] = HEX[b >>> 4];
            out[i * 2 + 1] = HEX[b & 0x0F];
        }
        return new String(out);
    }
}
