package com.scholary.video.assistant.api;

import com.scholary.video.assistant.quiz.RedactedQuestion;
import com.scholary.video.assistant.quiz.RedactedQuiz;
import java.util.List;

/**
 * A generated quiz as shown to the caller.
 *
 * <p>Questions carry prompt and options only.
 */
public record QuizResponse(
    String quizId, String videoId, String difficulty, List<RedactedQuestion> questions) {

  public static QuizResponse from(RedactedQuiz quiz) {
    return new QuizResponse(quiz.quizId(), quiz.videoId(), quiz.difficulty(), quiz.questions());
  }
}
