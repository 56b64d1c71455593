package com.snapsecret.util;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Utility class for secret identifier generation.
 *
 * The identifier is the only credential protecting an unchallenged
 * secret, so it carries 256 bits of entropy.
 */
public class SecretIdGenerator {

    private static final int ID_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private SecretIdGenerator() {
    }

    /**
     * Generate a new URL-safe secret identifier.
     *
     * @return 43 character Base64url identifier without padding
     */
    public static String generateId() {
        byte[] randomBytes = new byte[ID_BYTES];
        SECURE_RANDOM.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    /**
     * Shorten an identifier for log output (first 6 characters).
     *
     * @param id The secret identifier
     * @return Loggable prefix, e.g. abc123...
     */
    public static String abbreviate(String id) {
        if (id == null || id.length() <= 6) {
            return "******";
        }
        return id.substring(0, 6) + "...";
    }
}
