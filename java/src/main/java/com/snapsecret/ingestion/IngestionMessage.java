package com.snapsecret.ingestion;

import com.snapsecret.model.dto.IngestionRequest;
import lombok.Value;

/**
 * A queued creation request together with its delivery bookkeeping.
 */
@Value
public class IngestionMessage {

    String messageId;

    IngestionRequest request;

    /**
     * How many times this message has been handed to a consumer, including this delivery.
     */
    int deliveryCount;

    IngestionMessage nextDelivery() {
        return new IngestionMessage(messageId, request, deliveryCount + 1);
    }
}
