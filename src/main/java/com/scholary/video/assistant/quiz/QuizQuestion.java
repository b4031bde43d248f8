package com.scholary.video.assistant.quiz;

import java.util.HashSet;
import java.util.List;

/**
 * A multiple-choice question including its answer.
 *
 * <p>This form never leaves the server; callers only ever see {@link RedactedQuestion}.
 *
 * @param prompt the question text
 * @param options exactly four distinct options, in display order
 * @param correctOption the text of the correct option, one of {@code options}
 */
public record QuizQuestion(String prompt, List<String> options, String correctOption) {

  public static final int OPTION_COUNT = 4;

  public QuizQuestion {
    if (prompt == null || prompt.isBlank()) {
      throw new IllegalArgumentException("Question prompt must not be blank");
    }
    if (options == null || options.size() != OPTION_COUNT) {
      throw new IllegalArgumentException(
          String.format(
              "Question must have exactly %d options, got %s",
              OPTION_COUNT, options == null ? "none" : options.size()));
    }
    if (options.stream().anyMatch(option -> option == null || option.isBlank())) {
      throw new IllegalArgumentException("Options must not be blank");
    }
    if (new HashSet<>(options).size() != OPTION_COUNT) {
      throw new IllegalArgumentException("Options must be distinct: " + options);
    }
    if (correctOption == null || !options.contains(correctOption)) {
      throw new IllegalArgumentException("Correct option is not among the options");
    }
    options = List.copyOf(options);
  }

  /** Zero-based position of the correct option. */
  public int correctIndex() {
    return options.indexOf(correctOption);
  }

  public RedactedQuestion redact() {
    return new RedactedQuestion(prompt, options);
  }
}
