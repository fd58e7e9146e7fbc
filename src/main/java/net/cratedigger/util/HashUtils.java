package net.cratedigger.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers used for cache keys and library fingerprints.
 */
public final class HashUtils {

    private HashUtils() {
    }

    /**
     * Hashes a string (UTF-8) and returns the digest as lowercase hex.
     *
     * @param data text to hash, never {@code null}
     * @return 64-character hex digest
     * @throws IllegalArgumentException when {@code data} is {@code null}
     * @throws IllegalStateException when the JVM lacks SHA-256
     */
    public static String sha256Hex(String data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm unavailable", e);
        }
    }
}
