package com.snapsecret.ingestion;

import com.snapsecret.exception.IngestionRejectedException;
import com.snapsecret.model.dto.IngestionRequest;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Semaphore;

/**
 * Bounded process-local ingestion queue with visibility leases.
 *
 * Capacity counts every message not yet acknowledged, whether waiting
 * or leased.
 */
@Slf4j
@Component
public class InMemoryIngestionQueue implements IngestionQueue {

    private final Queue<IngestionMessage> ready = new ConcurrentLinkedQueue<>();
    private final Map<String, Lease> inFlight = new ConcurrentHashMap<>();
    private final Semaphore capacity;
    private final Duration leaseDuration;
    private final Clock clock;

    public InMemoryIngestionQueue(
            @Value("${snapsecret.ingestion.capacity:1000}") int capacity,
            @Value("${snapsecret.ingestion.lease:PT30S}") Duration leaseDuration,
            Clock clock) {
        this.capacity = new Semaphore(capacity);
        this.leaseDuration = leaseDuration;
        this.clock = clock;
    }

    @Override
    public Mono<Void> enqueue(IngestionRequest request) {
        return Mono.fromRunnable(() -> {
            if (!capacity.tryAcquire()) {
                throw new IngestionRejectedException("Ingestion queue is full, try again later");
            }
            IngestionMessage message = new IngestionMessage(UUID.randomUUID().toString(), request, 0);
            ready.offer(message);
            log.debug("Enqueued ingestion message {}", message.getMessageId());
        });
    }

    @Override
    public Mono<List<IngestionMessage>> receive(int maxMessages) {
        return Mono.fromSupplier(() -> {
            Instant now = clock.instant();
            reclaimLapsedLeases(now);

            List<IngestionMessage> delivered = new ArrayList<>();
            while (delivered.size() < maxMessages) {
                IngestionMessage next = ready.poll();
                if (next == null) {
                    break;
                }
                IngestionMessage delivery = next.nextDelivery();
                inFlight.put(delivery.getMessageId(), new Lease(delivery, now.plus(leaseDuration)));
                delivered.add(delivery);
            }
            return delivered;
        });
    }

    @Override
    public Mono<Void> acknowledge(IngestionMessage message) {
        return Mono.fromRunnable(() -> {
            if (inFlight.remove(message.getMessageId()) != null) {
                capacity.release();
            }
        });
    }

    @Override
    public Mono<Void> release(IngestionMessage message) {
        return Mono.fromRunnable(() -> {
            Lease lease = inFlight.remove(message.getMessageId());
            if (lease != null) {
                ready.offer(lease.getMessage());
            }
        });
    }

    /**
     * Messages not yet acknowledged, waiting or leased.
     */
    public int pending() {
        return ready.size() + inFlight.size();
    }

    private void reclaimLapsedLeases(Instant now) {
        inFlight.forEach((messageId, lease) -> {
            if (!now.isBefore(lease.getDeadline()) && inFlight.remove(messageId, lease)) {
                log.warn("Lease lapsed for ingestion message {}, redelivering", messageId);
                ready.offer(lease.getMessage());
            }
        });
    }

    @Getter
    @RequiredArgsConstructor
    private static final class Lease {
        private final IngestionMessage message;
        private final Instant deadline;
    }
}
