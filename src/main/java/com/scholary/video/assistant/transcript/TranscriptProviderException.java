package com.scholary.video.assistant.transcript;

import com.scholary.video.assistant.error.DependencyFailureException;

/**
 * Exception thrown when transcript provider calls fail.
 *
 * <p>This could be due to network issues, service unavailability, or invalid responses.
 */
public class TranscriptProviderException extends DependencyFailureException {

  public TranscriptProviderException(String message) {
    super(message);
  }

  public TranscriptProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
