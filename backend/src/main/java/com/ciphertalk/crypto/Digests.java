package com.ciphertalk.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

import com.ciphertalk.error.ValidationException;

/**
 * SHA-256 based identifiers: content hashes, key fingerprints and conversation session ids.
 */
public final class Digests {

    private Digests() {}

    public static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public static String sha256Hex(String text) {
        return HexFormat.of().formatHex(sha256(text.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Fingerprint of a raw public key: SHA-256 as upper-case hex pairs joined by colons,
     * e.g. {@code 3A:F0:...}. Always recomputable from the key alone.
     */
    public static String fingerprint(byte[] publicKey) {
        return HexFormat.ofDelimiter(":").withUpperCase().formatHex(sha256(publicKey));
    }

    /**
     * Order-independent conversation id: both directions of a pair map to the same session.
     */
    public static String sessionIdFor(String userA, String userB) {
        if (userA == null || userB == null || userA.isBlank() || userB.isBlank()) {
            throw new ValidationException("Both participants are required");
        }
        if (userA.equals(userB)) {
            throw new ValidationException("A session needs two distinct users");
        }
        String first = userA.compareTo(userB) < 0 ? userA : userB;
        String second = first.equals(userA) ? userB : userA;
        return sha256Hex(first + ":" + second);
    }

    /** Constant-time comparison of two hex digests, case-insensitive. */
    public static boolean hexEquals(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII),
                actual.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
    }
}
