package com.scholary.video.assistant.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Submitted answers for a generated quiz.
 *
 * <p>{@code userAnswers[i]} is the zero-based option index chosen for question {@code i}; null or
 * missing entries count as unanswered.
 */
public record VerifyAnswersRequest(@NotBlank String quizId, @NotNull List<Integer> userAnswers) {}
