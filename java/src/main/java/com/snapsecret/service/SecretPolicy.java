package com.snapsecret.service;

import com.snapsecret.exception.ValidationFailedException;
import com.snapsecret.model.entity.SecretDraft;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Size bounds and TTL ceiling applied to every submitted secret.
 */
@Component
public class SecretPolicy {

    @Value("${snapsecret.secret.max-text-length:10000}")
    private int maxTextLength;

    @Value("${snapsecret.secret.max-prompt-length:1000}")
    private int maxPromptLength;

    @Value("${snapsecret.secret.max-expire-in:P7D}")
    private Duration maxExpireIn;

    /**
     * Validate a draft and clamp its TTL.
     *
     * @param draft Submitted draft
     * @return Draft whose {@code expireIn} is set and at most the configured maximum
     * @throws ValidationFailedException if the draft is malformed or too large
     */
    public SecretDraft apply(SecretDraft draft) {
        if (draft.getText() == null || draft.getText().isEmpty()) {
            throw new ValidationFailedException("Secret text must not be empty");
        }
        if (draft.getText().length() > maxTextLength) {
            throw new ValidationFailedException(
                    String.format("Secret text must be at most %d characters", maxTextLength));
        }
        if (draft.hasPrompt() != draft.hasAnswer()) {
            throw new ValidationFailedException("Prompt and answer must be provided together");
        }
        if (draft.hasPrompt()
                && (draft.getPrompt().length() > maxPromptLength || draft.getAnswer().length() > maxPromptLength)) {
            throw new ValidationFailedException(
                    String.format("Prompt and answer must be at most %d characters", maxPromptLength));
        }

        Duration expireIn = draft.getExpireIn();
        if (expireIn != null && expireIn.isNegative()) {
            throw new ValidationFailedException("Expiration must not be negative");
        }
        if (expireIn == null || expireIn.compareTo(maxExpireIn) > 0) {
            expireIn = maxExpireIn;
        }
        return draft.toBuilder().expireIn(expireIn).build();
    }
}
