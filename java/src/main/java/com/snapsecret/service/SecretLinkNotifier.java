package com.snapsecret.service;

import com.snapsecret.model.dto.IngestionRequest;
import com.snapsecret.util.SecretIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Map;

/**
 * Posts the link of a secret created from the ingestion queue back to
 * the producer's reply URL (Slack {@code response_url}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecretLinkNotifier {

    private final WebClient.Builder webClientBuilder;

    @Value("${snapsecret.ingestion.allowed-reply-url-prefix:https://hooks.slack.com/}")
    private String allowedReplyUrlPrefix;

    /**
     * Post the secret link to the request's reply URL, if it has one.
     * Failures are logged and swallowed: the secret exists either way.
     *
     * @param request  Original ingestion request
     * @param secretId Identifier of the created secret
     * @return Completes once the reply was posted or given up on
     */
    public Mono<Void> postLink(IngestionRequest request, String secretId) {
        return post(request.getReplyUrl(), buildLink(request.getBaseSecretsPath(), secretId))
                .doOnSuccess(posted -> {
                    if (Boolean.TRUE.equals(posted)) {
                        log.info("Posted link for secret {}", SecretIdGenerator.abbreviate(secretId));
                    }
                })
                .then();
    }

    /**
     * Tell the producer its request was rejected and no secret was created.
     *
     * @param request Original ingestion request
     * @param reason  Client-facing rejection reason
     * @return Completes once the reply was posted or given up on
     */
    public Mono<Void> postRejection(IngestionRequest request, String reason) {
        return post(request.getReplyUrl(), "Your secret could not be created: " + reason)
                .doOnSuccess(posted -> {
                    if (Boolean.TRUE.equals(posted)) {
                        log.info("Posted rejection to {}", hostOf(request.getReplyUrl()));
                    }
                })
                .then();
    }

    private Mono<Boolean> post(String replyUrl, String text) {
        if (replyUrl == null || replyUrl.isBlank()) {
            return Mono.just(false);
        }
        if (!replyUrl.startsWith(allowedReplyUrlPrefix)) {
            log.warn("Refusing to post to disallowed reply host {}", hostOf(replyUrl));
            return Mono.just(false);
        }

        Map<String, Object> body = Map.of(
                "replace_original", true,
                "text", text
        );

        return webClientBuilder.build()
                .post()
                .uri(replyUrl)
                .header("Content-Type", "application/json")
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .thenReturn(true)
                .onErrorResume(error -> {
                    log.warn("Failed to post reply to {}: {}", hostOf(replyUrl), error.getMessage());
                    return Mono.just(false);
                });
    }

    static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host : "<unknown>";
        } catch (IllegalArgumentException e) {
            return "<malformed>";
        }
    }

    static String buildLink(String baseSecretsPath, String secretId) {
        if (baseSecretsPath == null || baseSecretsPath.isEmpty()) {
            return secretId;
        }
        return baseSecretsPath.endsWith("/") ? baseSecretsPath + secretId : baseSecretsPath + "/" + secretId;
    }
}
