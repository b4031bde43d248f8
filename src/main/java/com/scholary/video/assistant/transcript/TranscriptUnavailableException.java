package com.scholary.video.assistant.transcript;

import com.scholary.video.assistant.error.AssistantException;
import com.scholary.video.assistant.error.ErrorKind;

/**
 * The video has no usable transcript.
 *
 * <p>An expected negative outcome, not an error. It is never cached.
 */
public class TranscriptUnavailableException extends AssistantException {

  /** Why no transcript could be produced. */
  public enum Reason {
    DISABLED,
    NOT_FOUND,
    EMPTY
  }

  private final VideoId videoId;
  private final Reason reason;

  public TranscriptUnavailableException(VideoId videoId, Reason reason) {
    super(
        ErrorKind.NOT_AVAILABLE,
        String.format("Transcript not available for video %s (%s)", videoId, reason));
    this.videoId = videoId;
    this.reason = reason;
  }

  public VideoId videoId() {
    return videoId;
  }

  public Reason reason() {
    return reason;
  }
}
