package com.snapsecret.service;

import com.snapsecret.exception.ChallengeFailedException;
import com.snapsecret.exception.InvalidSecretException;
import com.snapsecret.exception.SecretLifecycleException;
import com.snapsecret.exception.SecretNotFoundException;
import com.snapsecret.exception.StorageFailureException;
import com.snapsecret.exception.ValidationFailedException;
import com.snapsecret.model.entity.SecretAccessResult;
import com.snapsecret.model.entity.SecretDraft;
import com.snapsecret.repository.ConsumeOutcome;
import com.snapsecret.repository.SecretStore;
import com.snapsecret.util.SecretIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Service for the secret lifecycle: submission and one-time access.
 *
 * The only place where store outcomes are turned into the public error
 * vocabulary. Stateless; storage errors are not retried here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecretService {

    private final SecretStore secretStore;
    private final SecretPolicy secretPolicy;

    /**
     * Submit a new secret.
     *
     * @param draft Text, optional prompt/answer pair and optional TTL
     * @return Identifier of the created secret
     */
    public Mono<String> submit(SecretDraft draft) {
        return Mono.fromCallable(() -> secretPolicy.apply(draft))
                .flatMap(secretStore::create)
                .doOnNext(id -> log.info("Created secret {}", SecretIdGenerator.abbreviate(id)))
                .onErrorMap(this::translate);
    }

    /**
     * Access a secret.
     *
     * Without an answer, a challenged secret yields its prompt and stays
     * available. With an answer, the answer is validated and the secret
     * consumed on a match.
     *
     * @param id     Secret identifier
     * @param answer Answer to the secret's challenge; {@code null} or empty when none was given
     * @return Revealed text, or the prompt when a challenge must be answered first
     */
    public Mono<SecretAccessResult> access(String id, String answer) {
        Mono<ConsumeOutcome> outcome = answer == null || answer.isEmpty()
                ? secretStore.consumeIfValid(id)
                : secretStore.validateAndConsume(id, answer);

        return outcome
                .flatMap(result -> toAccessResult(id, result))
                .onErrorMap(this::translate);
    }

    private Mono<SecretAccessResult> toAccessResult(String id, ConsumeOutcome outcome) {
        switch (outcome.getStatus()) {
            case REVEALED:
                log.info("Revealed secret {}", SecretIdGenerator.abbreviate(id));
                return Mono.just(SecretAccessResult.revealed(outcome.getText()));
            case CHALLENGE_REQUIRED:
                return Mono.just(SecretAccessResult.challengeRequired(outcome.getPrompt()));
            case ANSWER_MISMATCH:
                log.warn("Wrong answer for secret {}", SecretIdGenerator.abbreviate(id));
                return Mono.error(new ChallengeFailedException());
            case ABSENT:
            default:
                return Mono.error(new SecretNotFoundException());
        }
    }

    private Throwable translate(Throwable error) {
        if (error instanceof SecretLifecycleException) {
            return error;
        }
        if (error instanceof InvalidSecretException) {
            return new ValidationFailedException(error.getMessage());
        }
        log.error("Secret store failure", error);
        return new StorageFailureException("Secret storage is unavailable", error);
    }
}
