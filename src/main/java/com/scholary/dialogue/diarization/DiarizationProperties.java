package com.scholary.dialogue.diarization;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the diarization API client. Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "diarization")
@Validated
public record DiarizationProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
