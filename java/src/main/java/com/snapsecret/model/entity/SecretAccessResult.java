package com.snapsecret.model.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.ToString;
import lombok.Value;

/**
 * Successful outcome of an access: either the revealed text, or the
 * prompt the reader must answer first.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SecretAccessResult {

    @ToString.Exclude
    String text;

    String prompt;

    public static SecretAccessResult revealed(String text) {
        return new SecretAccessResult(text, null);
    }

    public static SecretAccessResult challengeRequired(String prompt) {
        return new SecretAccessResult(null, prompt);
    }

    public boolean isChallengeRequired() {
        return text == null;
    }
}
