package com.snapsecret.ingestion;

import com.snapsecret.model.dto.IngestionRequest;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * At-least-once queue decoupling slow producers from secret creation.
 *
 * A received message is leased to its consumer. It is removed only when
 * acknowledged; a released message, or one whose lease lapses, is
 * delivered again.
 */
public interface IngestionQueue {

    /**
     * @throws com.snapsecret.exception.IngestionRejectedException (as error signal) when the queue is full
     */
    Mono<Void> enqueue(IngestionRequest request);

    Mono<List<IngestionMessage>> receive(int maxMessages);

    Mono<Void> acknowledge(IngestionMessage message);

    Mono<Void> release(IngestionMessage message);
}
