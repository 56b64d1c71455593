package com.snapsecret.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;

/**
 * Compares a supplied answer against a secret's stored answer.
 *
 * Exact and case-sensitive unless {@code snapsecret.challenge.case-sensitive}
 * is turned off. Never consumes anything.
 */
@Component
public class ChallengeValidator {

    @Value("${snapsecret.challenge.case-sensitive:true}")
    private boolean caseSensitive;

    /**
     * @param expected Answer stored with the secret
     * @param supplied Answer presented by the reader
     * @return true on an exact match
     */
    public boolean matches(String expected, String supplied) {
        if (expected == null || supplied == null) {
            return false;
        }
        // constant-time comparison
        return MessageDigest.isEqual(normalize(expected), normalize(supplied));
    }

    private byte[] normalize(String answer) {
        String value = caseSensitive ? answer : answer.toLowerCase(Locale.ROOT);
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
