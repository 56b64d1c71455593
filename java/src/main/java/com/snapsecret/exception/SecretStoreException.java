package com.snapsecret.exception;

/**
 * Exception thrown by a secret store when its backend is unavailable or fails.
 */
public class SecretStoreException extends RuntimeException {

    public SecretStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
