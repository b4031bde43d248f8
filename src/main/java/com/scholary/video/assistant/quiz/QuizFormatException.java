package com.scholary.video.assistant.quiz;

import com.scholary.video.assistant.generation.GenerationException;

/** The generation backend answered a quiz request with output that does not fit the schema. */
public class QuizFormatException extends GenerationException {

  public QuizFormatException(String message) {
    super(message);
  }

  public QuizFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
