package com.snapsecret.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Health check endpoints.
 */
@RestController
@RequestMapping
public class HealthController {

    private static final String VERSION = "1.0.0";

    private final String storeType;

    public HealthController(@Value("${snapsecret.store.type:r2dbc}") String storeType) {
        this.storeType = storeType;
    }

    @GetMapping("/")
    public Mono<Map<String, String>> root() {
        return Mono.just(Map.of(
            "service", "SnapSecret",
            "version", VERSION
        ));
    }

    @GetMapping("/v1/health")
    public Mono<Map<String, String>> health() {
        return Mono.just(Map.of(
            "status", "healthy",
            "store", storeType,
            "version", VERSION
        ));
    }
}
