package com.scholary.video.assistant.transcript;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the transcript provider client.
 *
 * <p>Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "transcript-provider")
@Validated
public record TranscriptProviderProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
