package com.snapsecret.controller;

import com.snapsecret.exception.ValidationFailedException;
import com.snapsecret.ingestion.IngestionQueue;
import com.snapsecret.model.dto.IngestionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Slack slash-command endpoint.
 *
 * Slack expects an answer within three seconds, so the request is only
 * queued here; the link is posted to {@code response_url} once created.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SlackIngestionController {

    static final String ACKNOWLEDGEMENT = "We received your request and we're working on it...";

    private final IngestionQueue ingestionQueue;

    @PostMapping(path = "/v1/secrets-slack", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public Mono<Map<String, Object>> createSecretFromSlack(ServerWebExchange exchange) {
        return exchange.getFormData()
                .flatMap(form -> ingestionQueue.enqueue(toIngestionRequest(exchange, form)))
                .then(Mono.fromSupplier(() -> Map.<String, Object>of(
                        "replace_original", true,
                        "text", ACKNOWLEDGEMENT
                )));
    }

    private IngestionRequest toIngestionRequest(ServerWebExchange exchange, MultiValueMap<String, String> form) {
        String text = form.getFirst("text");
        if (text == null || text.isEmpty()) {
            throw new ValidationFailedException("Secret text must not be empty");
        }
        log.info("Queueing secret from Slack team {} channel {}", form.getFirst("team_id"), form.getFirst("channel_id"));

        return IngestionRequest.builder()
                .text(text)
                .baseSecretsPath(UriComponentsBuilder.fromUri(exchange.getRequest().getURI())
                        .replacePath("/v1/secrets/")
                        .replaceQuery(null)
                        .toUriString())
                .replyUrl(form.getFirst("response_url"))
                .slackChannelId(form.getFirst("channel_id"))
                .slackTeamId(form.getFirst("team_id"))
                .build();
    }
}
