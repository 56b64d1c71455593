package com.snapsecret.exception;

/**
 * Exception thrown by a secret store when a secret violates its construction invariants.
 */
public class InvalidSecretException extends RuntimeException {

    public InvalidSecretException(String message) {
        super(message);
    }
}
