package com.scholary.video.assistant.transcript;

import java.util.List;

/**
 * Source of caption segments for a video.
 *
 * <p>This abstraction allows swapping the caption source without changing the loader.
 */
public interface TranscriptProvider {

  /**
   * Fetch the caption segments of a video, in playback order.
   *
   * @param videoId the video to fetch
   * @return the segments
   * @throws TranscriptUnavailableException if captions are disabled or none exist
   * @throws TranscriptProviderException if the provider cannot be reached or answers garbage
   */
  List<TranscriptSegment> fetch(VideoId videoId);
}
