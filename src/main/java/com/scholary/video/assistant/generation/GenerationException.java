package com.scholary.video.assistant.generation;

import com.scholary.video.assistant.error.DependencyFailureException;

/**
 * Exception thrown when the generation backend fails or answers with unusable output.
 *
 * <p>Surfaced as a stage failure; the core does not retry.
 */
public class GenerationException extends DependencyFailureException {

  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
