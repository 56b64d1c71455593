package com.snapsecret.repository;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.ToString;
import lombok.Value;

/**
 * Raw outcome of a store access. The orchestrator translates it into
 * the public error vocabulary.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConsumeOutcome {

    public enum Status {
        /** This call consumed the secret; it is gone from the store. */
        REVEALED,
        /** The secret is challenged and was left untouched. */
        CHALLENGE_REQUIRED,
        /** Unknown, already consumed or expired. */
        ABSENT,
        /** The supplied answer was wrong; the secret was left untouched. */
        ANSWER_MISMATCH
    }

    private static final ConsumeOutcome ABSENT = new ConsumeOutcome(Status.ABSENT, null, null);
    private static final ConsumeOutcome ANSWER_MISMATCH = new ConsumeOutcome(Status.ANSWER_MISMATCH, null, null);

    Status status;

    @ToString.Exclude
    String text;

    String prompt;

    public static ConsumeOutcome revealed(String text) {
        return new ConsumeOutcome(Status.REVEALED, text, null);
    }

    public static ConsumeOutcome challengeRequired(String prompt) {
        return new ConsumeOutcome(Status.CHALLENGE_REQUIRED, null, prompt);
    }

    public static ConsumeOutcome absent() {
        return ABSENT;
    }

    public static ConsumeOutcome answerMismatch() {
        return ANSWER_MISMATCH;
    }
}
