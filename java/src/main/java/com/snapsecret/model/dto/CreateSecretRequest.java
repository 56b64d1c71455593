package com.snapsecret.model.dto;

import com.snapsecret.model.entity.SecretDraft;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Duration;

/**
 * Request DTO for creating a secret.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSecretRequest {

    @ToString.Exclude
    @NotEmpty(message = "Text is required")
    private String text;

    private String prompt;

    @ToString.Exclude
    private String answer;

    /**
     * ISO-8601 duration, e.g. {@code PT1H}.
     */
    private Duration expireIn;

    public SecretDraft toDraft() {
        return SecretDraft.builder()
                .text(text)
                .prompt(prompt)
                .answer(answer)
                .expireIn(expireIn)
                .build();
    }
}
