package com.snapsecret.exception;

/**
 * Exception thrown when the secret store could not complete an operation.
 */
public class StorageFailureException extends SecretLifecycleException {

    public StorageFailureException(String message, Throwable cause) {
        super(SecretErrorCode.STORAGE_FAILURE, message, cause);
    }
}
