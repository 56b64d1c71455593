package com.snapsecret.exception;

/**
 * Exception thrown when a secret is unknown, already revealed or expired.
 * The three cases are reported identically.
 */
public class SecretNotFoundException extends SecretLifecycleException {

    public SecretNotFoundException() {
        super(SecretErrorCode.NOT_FOUND, "Secret not found");
    }
}
