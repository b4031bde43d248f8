package com.scholary.video.assistant.quiz;

import java.util.List;

/** What the caller receives after generation: the quiz id and answer-free questions. */
public record RedactedQuiz(
    String quizId, String videoId, String difficulty, List<RedactedQuestion> questions) {}
