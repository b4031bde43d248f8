package com.scholary.video.assistant.quiz;

import com.scholary.video.assistant.error.AssistantException;
import com.scholary.video.assistant.error.ErrorKind;

/**
 * No answer key is held for the quiz id: it was never generated or has expired.
 *
 * <p>Distinct from a submission that is simply wrong.
 */
public class QuizNotFoundException extends AssistantException {

  private final String quizId;

  public QuizNotFoundException(String quizId) {
    super(ErrorKind.NOT_FOUND, "Quiz not found or expired: " + quizId);
    this.quizId = quizId;
  }

  public String quizId() {
    return quizId;
  }
}
