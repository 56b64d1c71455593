package com.snapsecret.service;

import com.snapsecret.repository.SecretStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Scheduled removal of expired secrets.
 *
 * Expired secrets are already unreachable through the store; this only
 * reclaims their storage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpiredSecretCleanupJob {

    private final SecretStore secretStore;
    private final Clock clock;

    @Scheduled(
            initialDelayString = "${snapsecret.cleanup.interval-ms:3600000}",
            fixedRateString = "${snapsecret.cleanup.interval-ms:3600000}")
    public void cleanupExpiredSecrets() {
        try {
            Long removed = secretStore.purgeExpired(clock.instant()).block();
            if (removed != null && removed > 0) {
                log.info("Cleaned up {} expired secrets", removed);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to clean up expired secrets: {}", e.getMessage());
        }
    }
}
