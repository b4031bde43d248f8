package com.scholary.video.assistant.api;

import com.scholary.video.assistant.quiz.VerificationResult;
import java.util.List;

/** Per-question correctness of a submission. */
public record VerifyAnswersResponse(String quizId, List<Boolean> results, int correct, int total) {

  public static VerifyAnswersResponse from(VerificationResult result) {
    return new VerifyAnswersResponse(
        result.quizId(), result.results(), result.correct(), result.total());
  }
}
