package com.snapsecret.model.entity;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * Shareable text secret as persisted by a {@code SecretStore}.
 *
 * Immutable. The only state change a secret ever sees is its removal
 * when it is consumed or swept after expiry.
 */
@Value
@Builder
public class ShareableSecret {

    String id;

    @ToString.Exclude
    String text;

    String prompt;

    @ToString.Exclude
    String answer;

    Instant createdAt;

    Instant expiresAt;

    public boolean hasChallenge() {
        return prompt != null;
    }

    /**
     * A secret is expired from its {@code expiresAt} instant onwards.
     * Secrets without an expiry never expire.
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
