package com.snapsecret.repository;

import com.snapsecret.exception.SecretStoreException;
import com.snapsecret.model.entity.SecretDraft;
import com.snapsecret.model.entity.ShareableSecret;
import com.snapsecret.service.ChallengeValidator;
import com.snapsecret.util.SecretIdGenerator;
import io.r2dbc.spi.Row;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Secret store on a relational database through R2DBC.
 *
 * Timestamps are stored as epoch milliseconds. A reveal is decided by a
 * conditional {@code DELETE}: the row is read first (it is immutable),
 * but only the caller whose delete reports one affected row returns the
 * text. Concurrent readers of the same id therefore see at most one success.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "snapsecret.store.type", havingValue = "r2dbc", matchIfMissing = true)
public class R2dbcSecretStore implements SecretStore {

    private static final String INSERT_SQL =
            "INSERT INTO secrets (id, secret_text, prompt, answer, created_at, expires_at) " +
            "VALUES (:id, :text, :prompt, :answer, :createdAt, :expiresAt)";

    private static final String SELECT_LIVE_SQL =
            "SELECT id, secret_text, prompt, answer, created_at, expires_at FROM secrets " +
            "WHERE id = :id AND (expires_at IS NULL OR expires_at > :now)";

    private static final String DELETE_LIVE_SQL =
            "DELETE FROM secrets WHERE id = :id AND (expires_at IS NULL OR expires_at > :now)";

    private static final String PURGE_EXPIRED_SQL =
            "DELETE FROM secrets WHERE expires_at IS NOT NULL AND expires_at <= :now";

    private final DatabaseClient databaseClient;
    private final Clock clock;
    private final ChallengeValidator challengeValidator;

    public R2dbcSecretStore(DatabaseClient databaseClient, Clock clock, ChallengeValidator challengeValidator) {
        this.databaseClient = databaseClient;
        this.clock = clock;
        this.challengeValidator = challengeValidator;
    }

    @Override
    public Mono<String> create(SecretDraft draft) {
        return Mono.defer(() -> {
            draft.validate();
            ShareableSecret secret = draft.toSecret(SecretIdGenerator.generateId(), clock.instant());

            DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(INSERT_SQL)
                    .bind("id", secret.getId())
                    .bind("text", secret.getText())
                    .bind("createdAt", secret.getCreatedAt().toEpochMilli());
            spec = bindNullable(spec, "prompt", secret.getPrompt(), String.class);
            spec = bindNullable(spec, "answer", secret.getAnswer(), String.class);
            spec = bindNullable(spec, "expiresAt",
                    secret.getExpiresAt() != null ? secret.getExpiresAt().toEpochMilli() : null, Long.class);

            return spec.fetch()
                    .rowsUpdated()
                    .thenReturn(secret.getId());
        }).onErrorMap(DataAccessException.class, e -> new SecretStoreException("Failed to store secret", e));
    }

    @Override
    public Mono<ConsumeOutcome> consumeIfValid(String id) {
        return Mono.defer(() -> {
            long now = clock.millis();
            return findLive(id, now)
                    .flatMap(secret -> secret.hasChallenge()
                            ? Mono.just(ConsumeOutcome.challengeRequired(secret.getPrompt()))
                            : deleteLive(secret, now))
                    .defaultIfEmpty(ConsumeOutcome.absent());
        }).onErrorMap(DataAccessException.class, e -> new SecretStoreException("Failed to access secret", e));
    }

    @Override
    public Mono<ConsumeOutcome> validateAndConsume(String id, String answer) {
        return Mono.defer(() -> {
            long now = clock.millis();
            return findLive(id, now)
                    .flatMap(secret -> secret.hasChallenge() && !challengeValidator.matches(secret.getAnswer(), answer)
                            ? Mono.just(ConsumeOutcome.answerMismatch())
                            : deleteLive(secret, now))
                    .defaultIfEmpty(ConsumeOutcome.absent());
        }).onErrorMap(DataAccessException.class, e -> new SecretStoreException("Failed to access secret", e));
    }

    @Override
    public Mono<Long> purgeExpired(Instant now) {
        return databaseClient.sql(PURGE_EXPIRED_SQL)
                .bind("now", now.toEpochMilli())
                .fetch()
                .rowsUpdated()
                .onErrorMap(DataAccessException.class, e -> new SecretStoreException("Failed to purge expired secrets", e));
    }

    private Mono<ShareableSecret> findLive(String id, long now) {
        return databaseClient.sql(SELECT_LIVE_SQL)
                .bind("id", id)
                .bind("now", now)
                .map((row, metadata) -> toSecret(row))
                .one();
    }

    private Mono<ConsumeOutcome> deleteLive(ShareableSecret secret, long now) {
        return databaseClient.sql(DELETE_LIVE_SQL)
                .bind("id", secret.getId())
                .bind("now", now)
                .fetch()
                .rowsUpdated()
                .map(deleted -> {
                    if (deleted == 1) {
                        log.debug("Consumed secret {}", SecretIdGenerator.abbreviate(secret.getId()));
                        return ConsumeOutcome.revealed(secret.getText());
                    }
                    return ConsumeOutcome.absent();
                });
    }

    private ShareableSecret toSecret(Row row) {
        Long expiresAt = row.get("expires_at", Long.class);
        return ShareableSecret.builder()
                .id(row.get("id", String.class))
                .text(row.get("secret_text", String.class))
                .prompt(row.get("prompt", String.class))
                .answer(row.get("answer", String.class))
                .createdAt(Instant.ofEpochMilli(row.get("created_at", Long.class)))
                .expiresAt(expiresAt != null ? Instant.ofEpochMilli(expiresAt) : null)
                .build();
    }

    private static DatabaseClient.GenericExecuteSpec bindNullable(
            DatabaseClient.GenericExecuteSpec spec, String name, Object value, Class<?> type) {
        return value != null ? spec.bind(name, value) : spec.bindNull(name, type);
    }
}
