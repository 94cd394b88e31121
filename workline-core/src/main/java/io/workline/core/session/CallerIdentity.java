package io.workline.core.session;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One-way caller identity. Raw phone numbers never become keys or log fields.
 */
public final class CallerIdentity {
    private static final int HASH_HEX_CHARS = 16;

    private CallerIdentity() {
    }

    public static String hash(String phoneNumber) {
        String digits = normalize(phoneNumber);
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("phoneNumber must contain digits");
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(digits.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, HASH_HEX_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    static String normalize(String phoneNumber) {
        if (phoneNumber == null) {
            return "";
        }
        return phoneNumber.replaceAll("\\D", "");
    }
}
