package com.scholary.video.assistant.error;

/**
 * Failure categories surfaced at the boundary.
 *
 * <p>Each kind has a stable outcome code so callers can tell "try again" apart from "this video
 * has no transcript" and "your quiz session expired".
 */
public enum ErrorKind {
  INVALID_INPUT("INVALID_INPUT"),
  NOT_AVAILABLE("TRANSCRIPT_NOT_AVAILABLE"),
  NOT_FOUND("QUIZ_NOT_FOUND"),
  DEPENDENCY_FAILURE("DEPENDENCY_FAILURE");

  private final String code;

  ErrorKind(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
