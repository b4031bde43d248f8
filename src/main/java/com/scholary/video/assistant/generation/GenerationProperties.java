package com.scholary.video.assistant.generation;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the generation backend.
 *
 * <p>Any OpenAI-compatible chat-completions endpoint works. An empty {@code apiKey} sends no
 * Authorization header, which suits local backends. Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "generation")
@Validated
public record GenerationProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int maxTokens,
    @DecimalMin("0.0") @DecimalMax("2.0") double temperature,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
