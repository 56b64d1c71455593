package com.snapsecret.service;

import com.snapsecret.exception.SecretStoreException;
import com.snapsecret.repository.SecretStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ExpiredSecretCleanupJob.
 */
@ExtendWith(MockitoExtension.class)
class ExpiredSecretCleanupJobTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private SecretStore secretStore;

    @Test
    void cleanup_PurgesAtCurrentTime() {
        when(secretStore.purgeExpired(NOW)).thenReturn(Mono.just(3L));

        new ExpiredSecretCleanupJob(secretStore, Clock.fixed(NOW, ZoneOffset.UTC)).cleanupExpiredSecrets();

        verify(secretStore).purgeExpired(NOW);
    }

    @Test
    void cleanup_SurvivesStoreFailure() {
        when(secretStore.purgeExpired(NOW))
                .thenReturn(Mono.error(new SecretStoreException("down", new RuntimeException())));

        ExpiredSecretCleanupJob job = new ExpiredSecretCleanupJob(secretStore, Clock.fixed(NOW, ZoneOffset.UTC));

        assertThatCode(job::cleanupExpiredSecrets).doesNotThrowAnyException();
    }
}
