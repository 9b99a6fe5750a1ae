package com.phillippitts.dialogaugment.util;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers for content hashing and deterministic seeding.
 */
public final class Digests {

    private static final String SHA_256 = "SHA-256";

    private Digests() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns a fresh SHA-256 digest. Every JVM is required to provide SHA-256.
     */
    public static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance(SHA_256);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Lowercase hex SHA-256 of the UTF-8 bytes of {@code text}. */
    public static String sha256Hex(String text) {
        return HexFormat.of().formatHex(sha256().digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    /** First eight bytes of the SHA-256 of {@code text}, as a long. */
    public static long sha256Long(String text) {
        return ByteBuffer.wrap(sha256().digest(text.getBytes(StandardCharsets.UTF_8))).getLong();
    }
}
