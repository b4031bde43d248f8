package com.scholary.video.assistant.quiz;

import java.util.List;

/**
 * Per-question correctness of a submission, in question order.
 *
 * <p>Always as long as the quiz. Only booleans are exposed, never the answers.
 */
public record VerificationResult(String quizId, List<Boolean> results) {

  public VerificationResult {
    results = List.copyOf(results);
  }

  public int correct() {
    return (int) results.stream().filter(Boolean::booleanValue).count();
  }

  public int total() {
    return results.size();
  }
}
