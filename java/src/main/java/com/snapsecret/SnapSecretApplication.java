package com.snapsecret;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * SnapSecret Server Application
 *
 * One-time secret sharing API built with Spring Boot WebFlux.
 * A secret can be revealed exactly once, optionally behind a
 * prompt/answer challenge, and never after it expires.
 */
@SpringBootApplication
@EnableScheduling
public class SnapSecretApplication {

    public static void main(String[] args) {
        SpringApplication.run(SnapSecretApplication.class, args);
    }

}
