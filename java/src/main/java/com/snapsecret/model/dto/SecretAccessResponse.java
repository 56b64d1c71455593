package com.snapsecret.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.snapsecret.model.entity.SecretAccessResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for secret access.
 * Carries either the revealed text or the prompt of a pending challenge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SecretAccessResponse {
    private String text;
    private String prompt;
    private boolean challengeRequired;

    public static SecretAccessResponse from(SecretAccessResult result) {
        return SecretAccessResponse.builder()
                .text(result.getText())
                .prompt(result.getPrompt())
                .challengeRequired(result.isChallengeRequired())
                .build();
    }
}
