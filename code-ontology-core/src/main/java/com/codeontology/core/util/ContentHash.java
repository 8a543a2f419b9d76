package com.codeontology.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 hashing for stable, content-derived identifiers.
 *
 * <p>Used where an identifier must be short and stable but the source text (a repository
 * URL, for instance) is too long or contains characters unsuitable for an IRI segment.
 */
public final class ContentHash {

    private ContentHash() {
        // Utility class - no instantiation
    }

    /**
     * Returns the full lowercase hex SHA-256 digest of the input.
     *
     * @param input text to hash
     * @return 64 hex characters
     * @throws IllegalArgumentException if input is null or blank
     */
    public static String sha256Hex(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Input must not be null or blank");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Returns the first {@code length} hex characters of the SHA-256 digest.
     *
     * @param input text to hash
     * @param length number of characters, between 1 and 64
     * @return hash prefix
     */
    public static String shortHash(String input, int length) {
        if (length < 1 || length > 64) {
            throw new IllegalArgumentException("length must be between 1 and 64, got " + length);
        }
        return sha256Hex(input).substring(0, length);
    }
}
