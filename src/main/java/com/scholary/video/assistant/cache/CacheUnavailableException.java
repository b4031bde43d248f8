package com.scholary.video.assistant.cache;

import com.scholary.video.assistant.error.DependencyFailureException;

/** Thrown when the backing store cannot be read or written. */
public class CacheUnavailableException extends DependencyFailureException {

  public CacheUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
