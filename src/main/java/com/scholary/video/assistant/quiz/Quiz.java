package com.scholary.video.assistant.quiz;

import java.util.List;
import java.util.Objects;

/**
 * A generated quiz with its full answer key, as held in the secrecy store.
 *
 * <p>Written once at generation time and read back at verification time; never rewritten.
 */
public record Quiz(String quizId, String videoId, String difficulty, List<QuizQuestion> questions) {

  public Quiz {
    Objects.requireNonNull(quizId, "quizId");
    if (questions == null || questions.isEmpty()) {
      throw new IllegalArgumentException("Quiz must have at least one question");
    }
    questions = List.copyOf(questions);
  }

  public RedactedQuiz redact() {
    return new RedactedQuiz(
        quizId, videoId, difficulty, questions.stream().map(QuizQuestion::redact).toList());
  }
}
