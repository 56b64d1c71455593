package com.snapsecret.exception;

/**
 * Exception thrown when the presented answer does not match the secret's challenge.
 * The secret stays available for further attempts.
 */
public class ChallengeFailedException extends SecretLifecycleException {

    public ChallengeFailedException() {
        super(SecretErrorCode.CHALLENGE_FAILED, "The answer did not match");
    }
}
