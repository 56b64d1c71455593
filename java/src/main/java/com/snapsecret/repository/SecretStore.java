package com.snapsecret.repository;

import com.snapsecret.model.entity.SecretDraft;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Keyed storage for shareable secrets.
 *
 * Implementations are the only shared mutable state of the service and
 * must guarantee that a secret is revealed at most once, however many
 * readers race for it. An expired secret behaves exactly like an
 * unknown one, whether or not it has been physically removed yet.
 *
 * Backend failures surface as {@link com.snapsecret.exception.SecretStoreException}.
 */
public interface SecretStore {

    /**
     * Persist a new secret.
     *
     * @param draft Secret to store; its {@code expireIn} is added to the insertion time
     * @return Identifier of the stored secret
     * @throws com.snapsecret.exception.InvalidSecretException (as error signal) if the draft is invalid
     */
    Mono<String> create(SecretDraft draft);

    /**
     * Reveal an unchallenged secret, removing it in the same atomic step.
     * A challenged secret is not consumed; its prompt is returned instead.
     *
     * @param id Secret identifier
     * @return REVEALED, CHALLENGE_REQUIRED or ABSENT
     */
    Mono<ConsumeOutcome> consumeIfValid(String id);

    /**
     * Check the answer and, on a match, reveal and remove the secret atomically.
     * A secret without a challenge is revealed regardless of the answer.
     *
     * @param id     Secret identifier
     * @param answer Answer presented by the reader
     * @return REVEALED, ANSWER_MISMATCH or ABSENT
     */
    Mono<ConsumeOutcome> validateAndConsume(String id, String answer);

    /**
     * Physically remove secrets expired at {@code now}.
     *
     * @return Number of removed secrets
     */
    Mono<Long> purgeExpired(Instant now);
}
