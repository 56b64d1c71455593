package com.snapsecret.ingestion;

import com.snapsecret.exception.ValidationFailedException;
import com.snapsecret.model.dto.IngestionRequest;
import com.snapsecret.model.entity.SecretDraft;
import com.snapsecret.service.SecretLinkNotifier;
import com.snapsecret.service.SecretService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Drains the ingestion queue into {@link SecretService#submit}.
 *
 * Delivery is at-least-once, so a message may be submitted twice. That
 * only ever creates a second independent secret.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionQueueWorker {

    private final IngestionQueue ingestionQueue;
    private final SecretService secretService;
    private final SecretLinkNotifier secretLinkNotifier;

    @Value("${snapsecret.ingestion.batch-size:16}")
    private int batchSize;

    @Value("${snapsecret.ingestion.max-delivery-attempts:5}")
    private int maxDeliveryAttempts;

    @Scheduled(fixedDelayString = "${snapsecret.ingestion.poll-interval-ms:1000}")
    public void poll() {
        try {
            Integer created = drain().block();
            if (created != null && created > 0) {
                log.info("Created {} secrets from the ingestion queue", created);
            }
        } catch (RuntimeException e) {
            log.warn("Ingestion poll failed: {}", e.getMessage());
        }
    }

    /**
     * Process one batch of messages.
     *
     * @return Number of secrets created
     */
    public Mono<Integer> drain() {
        return ingestionQueue.receive(batchSize)
                .flatMapMany(Flux::fromIterable)
                .concatMap(this::process)
                .filter(Boolean::booleanValue)
                .count()
                .map(Long::intValue);
    }

    private Mono<Boolean> process(IngestionMessage message) {
        IngestionRequest request = message.getRequest();
        return secretService.submit(toDraft(request))
                .flatMap(secretId -> secretLinkNotifier.postLink(request, secretId).thenReturn(secretId))
                .flatMap(secretId -> ingestionQueue.acknowledge(message).thenReturn(true))
                .onErrorResume(error -> handleFailure(message, error));
    }

    private Mono<Boolean> handleFailure(IngestionMessage message, Throwable error) {
        if (error instanceof ValidationFailedException) {
            log.warn("Dropping invalid ingestion message {}: {}", message.getMessageId(), error.getMessage());
            return secretLinkNotifier.postRejection(message.getRequest(), error.getMessage())
                    .then(ingestionQueue.acknowledge(message))
                    .thenReturn(false);
        }
        if (message.getDeliveryCount() >= maxDeliveryAttempts) {
            log.error("Dropping ingestion message {} after {} attempts",
                    message.getMessageId(), message.getDeliveryCount(), error);
            return ingestionQueue.acknowledge(message).thenReturn(false);
        }
        log.warn("Ingestion message {} failed on attempt {}, will retry: {}",
                message.getMessageId(), message.getDeliveryCount(), error.getMessage());
        return ingestionQueue.release(message).thenReturn(false);
    }

    private SecretDraft toDraft(IngestionRequest request) {
        return SecretDraft.builder()
                .text(request.getText())
                .prompt(request.getPrompt())
                .answer(request.getAnswer())
                .expireIn(request.getExpireIn())
                .build();
    }
}
