package com.snapsecret.model.entity;

import com.snapsecret.exception.InvalidSecretException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * A secret as submitted by a producer, before the store has assigned
 * its identifier and creation time.
 *
 * An empty prompt or answer counts as absent.
 */
@Value
@Builder(toBuilder = true)
public class SecretDraft {

    String text;

    String prompt;

    String answer;

    /**
     * Time to live relative to creation. {@code null} means no explicit TTL.
     */
    Duration expireIn;

    public boolean hasPrompt() {
        return prompt != null && !prompt.isEmpty();
    }

    public boolean hasAnswer() {
        return answer != null && !answer.isEmpty();
    }

    /**
     * Check the construction invariants of a secret.
     *
     * @throws InvalidSecretException if text is empty, only one half of the
     *                                challenge is present, or the TTL is negative
     */
    public void validate() {
        if (text == null || text.isEmpty()) {
            throw new InvalidSecretException("Secret text must not be empty");
        }
        if (hasPrompt() != hasAnswer()) {
            throw new InvalidSecretException("Prompt and answer must be provided together");
        }
        if (expireIn != null && expireIn.isNegative()) {
            throw new InvalidSecretException("Expiration must not be negative");
        }
    }

    /**
     * Materialize the draft into a stored secret.
     *
     * @param id        Identifier assigned by the store
     * @param createdAt Insertion time
     * @return Immutable secret with {@code expiresAt = createdAt + expireIn}
     */
    public ShareableSecret toSecret(String id, Instant createdAt) {
        return ShareableSecret.builder()
                .id(id)
                .text(text)
                .prompt(hasPrompt() ? prompt : null)
                .answer(hasAnswer() ? answer : null)
                .createdAt(createdAt)
                .expiresAt(expireIn != null ? createdAt.plus(expireIn) : null)
                .build();
    }
}
