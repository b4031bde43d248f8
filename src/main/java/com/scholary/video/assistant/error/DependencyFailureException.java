package com.scholary.video.assistant.error;

/**
 * A collaborator (cache, transcript provider, generation backend) failed or answered with
 * something unusable.
 *
 * <p>Never retried by the core.
 */
public class DependencyFailureException extends AssistantException {

  public DependencyFailureException(String message) {
    super(ErrorKind.DEPENDENCY_FAILURE, message);
  }

  public DependencyFailureException(String message, Throwable cause) {
    super(ErrorKind.DEPENDENCY_FAILURE, message, cause);
  }
}
