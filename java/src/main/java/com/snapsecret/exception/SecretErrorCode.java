package com.snapsecret.exception;

/**
 * Fixed error vocabulary exposed to transport adapters.
 */
public enum SecretErrorCode {

    VALIDATION_FAILED("validation_failed"),
    NOT_FOUND("not_found"),
    CHALLENGE_FAILED("challenge_failed"),
    STORAGE_FAILURE("storage_failure");

    private final String code;

    SecretErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
