package com.snapsecret.controller;

import com.snapsecret.model.dto.CreateSecretRequest;
import com.snapsecret.model.dto.CreateSecretResponse;
import com.snapsecret.model.dto.SecretAccessResponse;
import com.snapsecret.service.SecretService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Controller for creating and revealing secrets.
 */
@RestController
@RequestMapping("/v1/secrets")
@RequiredArgsConstructor
public class SecretController {

    private final SecretService secretService;

    @PostMapping
    public Mono<ResponseEntity<CreateSecretResponse>> createSecret(
            @Valid @RequestBody CreateSecretRequest request,
            ServerHttpRequest httpRequest) {
        return secretService.submit(request.toDraft())
                .map(id -> ResponseEntity.created(secretLocation(httpRequest, id))
                        .body(CreateSecretResponse.builder()
                                .id(id)
                                .message("Successfully created secret")
                                .build()));
    }

    @GetMapping("/{id}")
    public Mono<SecretAccessResponse> accessSecret(
            @PathVariable String id,
            @RequestParam(required = false) String answer) {
        return secretService.access(id, answer)
                .map(SecretAccessResponse::from);
    }

    private URI secretLocation(ServerHttpRequest httpRequest, String id) {
        return UriComponentsBuilder.fromUri(httpRequest.getURI())
                .replaceQuery(null)
                .path("/{id}")
                .buildAndExpand(id)
                .toUri();
    }
}
