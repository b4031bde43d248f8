package com.scholary.video.assistant.quiz;

import com.scholary.video.assistant.error.InvalidInputException;
import java.util.Objects;

/** Parameters of the quiz generator stage. */
public record QuizParameters(Difficulty difficulty, int questionCount) {

  public QuizParameters {
    Objects.requireNonNull(difficulty, "difficulty");
    if (questionCount < 1) {
      throw new InvalidInputException("Question count must be positive: " + questionCount);
    }
  }
}
