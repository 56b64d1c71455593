package com.snapsecret.exception;

/**
 * Base class of the errors the secret lifecycle reports to its callers.
 */
public abstract class SecretLifecycleException extends RuntimeException {

    private final SecretErrorCode errorCode;

    protected SecretLifecycleException(SecretErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected SecretLifecycleException(SecretErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public SecretErrorCode getErrorCode() {
        return errorCode;
    }
}
