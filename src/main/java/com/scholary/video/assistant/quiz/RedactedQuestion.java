package com.scholary.video.assistant.quiz;

import java.util.List;

/**
 * The caller-facing view of a question. It has no answer field at all, so the answer cannot leak
 * through serialization.
 */
public record RedactedQuestion(String prompt, List<String> options) {

  public RedactedQuestion {
    options = List.copyOf(options);
  }
}
