package com.snapsecret.controller;

import com.snapsecret.config.SecurityConfig;
import com.snapsecret.exception.IngestionRejectedException;
import com.snapsecret.ingestion.IngestionQueue;
import com.snapsecret.model.dto.IngestionRequest;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Web layer tests for SlackIngestionController.
 */
@WebFluxTest(controllers = SlackIngestionController.class)
@Import(SecurityConfig.class)
class SlackIngestionControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private IngestionQueue ingestionQueue;

    @Test
    void createSecretFromSlack_QueuesAndAcknowledges() {
        when(ingestionQueue.enqueue(any(IngestionRequest.class))).thenReturn(Mono.empty());

        webTestClient.post()
                .uri("/v1/secrets-slack")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("text", "wifi password")
                        .with("channel_id", "C123")
                        .with("team_id", "T456")
                        .with("response_url", "https://hooks.slack.com/commands/T456/1"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.replace_original").isEqualTo(true)
                .jsonPath("$.text").isEqualTo(SlackIngestionController.ACKNOWLEDGEMENT);

        ArgumentCaptor<IngestionRequest> captor = ArgumentCaptor.forClass(IngestionRequest.class);
        verify(ingestionQueue).enqueue(captor.capture());
        IngestionRequest queued = captor.getValue();
        assertThat(queued.getText()).isEqualTo("wifi password");
        assertThat(queued.getSlackChannelId()).isEqualTo("C123");
        assertThat(queued.getSlackTeamId()).isEqualTo("T456");
        assertThat(queued.getReplyUrl()).isEqualTo("https://hooks.slack.com/commands/T456/1");
        assertThat(queued.getBaseSecretsPath()).endsWith("/v1/secrets/");
    }

    @Test
    void createSecretFromSlack_EmptyTextIsRejected() {
        webTestClient.post()
                .uri("/v1/secrets-slack")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("channel_id", "C123"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("validation_failed");

        verify(ingestionQueue, never()).enqueue(any());
    }

    @Test
    void createSecretFromSlack_FullQueueIsServiceUnavailable() {
        when(ingestionQueue.enqueue(any(IngestionRequest.class)))
                .thenReturn(Mono.error(new IngestionRejectedException("Ingestion queue is full, try again later")));

        webTestClient.post()
                .uri("/v1/secrets-slack")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("text", "wifi password"))
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("ingestion_rejected");
    }
}
