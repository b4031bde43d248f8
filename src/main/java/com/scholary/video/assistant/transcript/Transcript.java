package com.scholary.video.assistant.transcript;

import java.util.Objects;

/**
 * Concatenated caption text of one video.
 *
 * <p>Never blank: a video without usable captions has no Transcript at all.
 */
public record Transcript(VideoId videoId, String text, Source source) {

  /** Where the transcript was served from. */
  public enum Source {
    CACHE,
    PROVIDER
  }

  public Transcript {
    Objects.requireNonNull(videoId, "videoId");
    Objects.requireNonNull(source, "source");
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Transcript text must not be blank for " + videoId);
    }
  }

  public boolean cached() {
    return source == Source.CACHE;
  }
}
