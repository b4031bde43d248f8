package com.scholary.video.assistant.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Request for generating a quiz.
 *
 * <p>{@code difficulty} is one of easy, medium, hard.
 */
public record QuizRequest(
    String videoUrl, String videoId, @NotBlank String difficulty, @Positive Integer numQuestions) {

  // Provide defaults
  public QuizRequest {
    if (numQuestions == null) {
      numQuestions = 5;
    }
  }
}
