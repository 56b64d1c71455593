package com.snapsecret.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Duration;

/**
 * Secret creation request from an asynchronous producer, carried through the ingestion queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionRequest {

    @ToString.Exclude
    private String text;

    private String prompt;

    @ToString.Exclude
    private String answer;

    private Duration expireIn;

    /**
     * Prefix the secret identifier is appended to when the link is posted back.
     */
    private String baseSecretsPath;

    /**
     * Producer endpoint that receives the link out of band (Slack {@code response_url}).
     */
    private String replyUrl;

    private String slackChannelId;

    private String slackTeamId;
}
