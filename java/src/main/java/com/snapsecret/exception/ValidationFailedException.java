package com.snapsecret.exception;

/**
 * Exception thrown when a submitted secret is malformed.
 */
public class ValidationFailedException extends SecretLifecycleException {

    public ValidationFailedException(String message) {
        super(SecretErrorCode.VALIDATION_FAILED, message);
    }
}
