package com.phillippitts.podscribe.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stable SHA-256 hashing for episode identifiers.
 */
public final class Hashing {

    /** Separates hashed fields so that ("ab", "c") and ("a", "bc") never collide. */
    private static final char FIELD_SEPARATOR = '\u001F';

    private Hashing() {
        // Utility class - prevent instantiation
    }

    /**
     * Hashes the given fields, in order, into a lower-case hex SHA-256 string.
     * Null fields hash as the empty string.
     */
    public static String sha256Hex(String... fields) {
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < fields.length; i++) {
            if (i > 0) {
                joined.append(FIELD_SEPARATOR);
            }
            joined.append(fields[i] == null ? "" : fields[i]);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(joined.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
