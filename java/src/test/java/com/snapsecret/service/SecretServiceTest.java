package com.snapsecret.service;

import com.snapsecret.exception.ChallengeFailedException;
import com.snapsecret.exception.InvalidSecretException;
import com.snapsecret.exception.SecretNotFoundException;
import com.snapsecret.exception.SecretStoreException;
import com.snapsecret.exception.StorageFailureException;
import com.snapsecret.exception.ValidationFailedException;
import com.snapsecret.model.entity.SecretDraft;
import com.snapsecret.repository.ConsumeOutcome;
import com.snapsecret.repository.SecretStore;
import com.snapsecret.util.TestComponents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SecretService.
 */
@ExtendWith(MockitoExtension.class)
class SecretServiceTest {

    @Mock
    private SecretStore secretStore;

    private SecretService secretService;

    @BeforeEach
    void setUp() {
        secretService = new SecretService(secretStore, TestComponents.secretPolicy());
    }

    @Test
    void submit_Success() {
        when(secretStore.create(any(SecretDraft.class))).thenReturn(Mono.just("secret-id"));

        StepVerifier.create(secretService.submit(SecretDraft.builder().text("hello").build()))
                .expectNext("secret-id")
                .verifyComplete();

        ArgumentCaptor<SecretDraft> captor = ArgumentCaptor.forClass(SecretDraft.class);
        verify(secretStore).create(captor.capture());
        assertThat(captor.getValue().getExpireIn()).isEqualTo(Duration.ofDays(7));
    }

    @Test
    void submit_InvalidInputNeverReachesStore() {
        StepVerifier.create(secretService.submit(SecretDraft.builder().text("hello").prompt("q").build()))
                .expectError(ValidationFailedException.class)
                .verify();

        verify(secretStore, never()).create(any());
    }

    @Test
    void submit_StoreRejectionBecomesValidationFailed() {
        when(secretStore.create(any(SecretDraft.class)))
                .thenReturn(Mono.error(new InvalidSecretException("bad")));

        StepVerifier.create(secretService.submit(SecretDraft.builder().text("hello").build()))
                .expectError(ValidationFailedException.class)
                .verify();
    }

    @Test
    void submit_BackendErrorBecomesStorageFailure() {
        when(secretStore.create(any(SecretDraft.class)))
                .thenReturn(Mono.error(new SecretStoreException("down", new RuntimeException())));

        StepVerifier.create(secretService.submit(SecretDraft.builder().text("hello").build()))
                .expectError(StorageFailureException.class)
                .verify();
    }

    @Test
    void access_WithoutAnswerUsesConsumeIfValid() {
        when(secretStore.consumeIfValid("id")).thenReturn(Mono.just(ConsumeOutcome.revealed("text")));

        StepVerifier.create(secretService.access("id", null))
                .expectNextMatches(result -> !result.isChallengeRequired() && result.getText().equals("text"))
                .verifyComplete();

        verify(secretStore, never()).validateAndConsume(anyString(), anyString());
    }

    @Test
    void access_EmptyAnswerCountsAsNoAnswer() {
        when(secretStore.consumeIfValid("id")).thenReturn(Mono.just(ConsumeOutcome.challengeRequired("prompt")));

        StepVerifier.create(secretService.access("id", ""))
                .expectNextMatches(result -> result.isChallengeRequired() && result.getPrompt().equals("prompt"))
                .verifyComplete();
    }

    @Test
    void access_WithAnswerUsesValidateAndConsume() {
        when(secretStore.validateAndConsume("id", "blue")).thenReturn(Mono.just(ConsumeOutcome.revealed("text")));

        StepVerifier.create(secretService.access("id", "blue"))
                .expectNextMatches(result -> result.getText().equals("text"))
                .verifyComplete();
    }

    @Test
    void access_MismatchBecomesChallengeFailed() {
        when(secretStore.validateAndConsume("id", "Blue")).thenReturn(Mono.just(ConsumeOutcome.answerMismatch()));

        StepVerifier.create(secretService.access("id", "Blue"))
                .expectError(ChallengeFailedException.class)
                .verify();
    }

    @Test
    void access_AbsentBecomesNotFound() {
        when(secretStore.consumeIfValid("id")).thenReturn(Mono.just(ConsumeOutcome.absent()));

        StepVerifier.create(secretService.access("id", null))
                .expectError(SecretNotFoundException.class)
                .verify();
    }

    @Test
    void access_BackendErrorBecomesStorageFailure() {
        when(secretStore.consumeIfValid("id"))
                .thenReturn(Mono.error(new SecretStoreException("down", new RuntimeException())));

        StepVerifier.create(secretService.access("id", null))
                .expectError(StorageFailureException.class)
                .verify();
    }
}
