package com.snapsecret.repository;

import com.snapsecret.model.entity.SecretDraft;
import com.snapsecret.model.entity.ShareableSecret;
import com.snapsecret.service.ChallengeValidator;
import com.snapsecret.util.SecretIdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local secret store backed by a {@link ConcurrentHashMap}.
 *
 * Consumption uses {@link ConcurrentHashMap#remove(Object, Object)}, so of
 * all readers holding the same entry exactly one removes it.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "snapsecret.store.type", havingValue = "memory")
public class InMemorySecretStore implements SecretStore {

    private final Map<String, ShareableSecret> secrets = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ChallengeValidator challengeValidator;

    public InMemorySecretStore(Clock clock, ChallengeValidator challengeValidator) {
        this.clock = clock;
        this.challengeValidator = challengeValidator;
    }

    @Override
    public Mono<String> create(SecretDraft draft) {
        return Mono.fromCallable(() -> {
            draft.validate();
            ShareableSecret secret = draft.toSecret(SecretIdGenerator.generateId(), clock.instant());
            secrets.put(secret.getId(), secret);
            return secret.getId();
        });
    }

    @Override
    public Mono<ConsumeOutcome> consumeIfValid(String id) {
        return Mono.fromSupplier(() -> {
            ShareableSecret secret = findLive(id);
            if (secret == null) {
                return ConsumeOutcome.absent();
            }
            if (secret.hasChallenge()) {
                return ConsumeOutcome.challengeRequired(secret.getPrompt());
            }
            return consume(secret);
        });
    }

    @Override
    public Mono<ConsumeOutcome> validateAndConsume(String id, String answer) {
        return Mono.fromSupplier(() -> {
            ShareableSecret secret = findLive(id);
            if (secret == null) {
                return ConsumeOutcome.absent();
            }
            if (secret.hasChallenge() && !challengeValidator.matches(secret.getAnswer(), answer)) {
                return ConsumeOutcome.answerMismatch();
            }
            return consume(secret);
        });
    }

    @Override
    public Mono<Long> purgeExpired(Instant now) {
        return Mono.fromSupplier(() -> {
            long removed = 0;
            for (ShareableSecret secret : secrets.values()) {
                if (secret.isExpired(now) && secrets.remove(secret.getId(), secret)) {
                    removed++;
                }
            }
            return removed;
        });
    }

    /**
     * Number of entries currently held, including expired ones not yet swept.
     */
    public int size() {
        return secrets.size();
    }

    private ShareableSecret findLive(String id) {
        if (id == null) {
            return null;
        }
        ShareableSecret secret = secrets.get(id);
        if (secret == null) {
            return null;
        }
        if (secret.isExpired(clock.instant())) {
            secrets.remove(id, secret);
            return null;
        }
        return secret;
    }

    private ConsumeOutcome consume(ShareableSecret secret) {
        if (secrets.remove(secret.getId(), secret)) {
            log.debug("Consumed secret {}", SecretIdGenerator.abbreviate(secret.getId()));
            return ConsumeOutcome.revealed(secret.getText());
        }
        return ConsumeOutcome.absent();
    }
}
