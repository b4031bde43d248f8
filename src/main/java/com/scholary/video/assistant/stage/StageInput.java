package com.scholary.video.assistant.stage;

import com.scholary.video.assistant.transcript.Transcript;
import com.scholary.video.assistant.transcript.VideoId;
import java.util.Objects;

/** Immutable input bundle handed to a single stage. */
public record StageInput<P>(Transcript transcript, P parameters) {

  public StageInput {
    Objects.requireNonNull(transcript, "transcript");
  }

  public VideoId videoId() {
    return transcript.videoId();
  }

  public String text() {
    return transcript.text();
  }
}
