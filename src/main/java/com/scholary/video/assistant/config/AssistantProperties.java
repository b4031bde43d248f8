package com.scholary.video.assistant.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the assistant core.
 *
 * <p>Controls the cache backend and the quiz secrecy window.
 */
@ConfigurationProperties(prefix = "assistant")
@Validated
public record AssistantProperties(@Valid CacheProperties cache, @Valid QuizProperties quiz) {

  /**
   * Cache backend and in-memory bounds.
   *
   * @param maxSize bound on in-memory entries without expiry (transcripts)
   * @param expiringMaxSize separate bound on in-memory entries with expiry (quizzes)
   */
  public record CacheProperties(
      @NotNull @Pattern(regexp = "memory|redis") String backend,
      @Positive long maxSize,
      @Positive long expiringMaxSize) {}

  public record QuizProperties(@NotNull Duration ttl, @Positive int maxQuestions) {}
}
