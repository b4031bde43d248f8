package com.scholary.video.assistant.error;

/**
 * Base class for every expected failure raised by the assistant core.
 *
 * <p>Unchecked: a failure in any stage aborts the whole request, and the boundary translates the
 * {@link ErrorKind} into an outcome code.
 */
public abstract class AssistantException extends RuntimeException {

  private final ErrorKind kind;

  protected AssistantException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected AssistantException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}
