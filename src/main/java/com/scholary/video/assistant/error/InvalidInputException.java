package com.scholary.video.assistant.error;

/** Thrown for malformed client input, before any external call is made. */
public class InvalidInputException extends AssistantException {

  public InvalidInputException(String message) {
    super(ErrorKind.INVALID_INPUT, message);
  }
}
