package com.snapsecret.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for secret creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSecretResponse {
    private String id;
    private String message;
}
