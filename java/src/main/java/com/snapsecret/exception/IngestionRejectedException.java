package com.snapsecret.exception;

/**
 * Exception thrown when the ingestion queue cannot accept another request.
 */
public class IngestionRejectedException extends RuntimeException {

    public IngestionRejectedException(String message) {
        super(message);
    }
}
