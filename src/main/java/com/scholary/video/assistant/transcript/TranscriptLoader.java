package com.scholary.video.assistant.transcript;

import com.scholary.video.assistant.cache.KeyValueCache;
import com.scholary.video.assistant.logging.StructuredLogger;
import com.scholary.video.assistant.transcript.TranscriptUnavailableException.Reason;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the transcript of a video, consulting the cache before the provider.
 *
 * <p>A successful fetch is written through to the cache without expiry. Negative outcomes
 * (captions disabled, none found, blank text) are never cached, so a video whose captions are
 * enabled later is picked up without manual eviction.
 *
 * <p>Two concurrent first fetches of the same video may both reach the provider and both write
 * the same text. That race is benign and deliberately not locked.
 */
@Component
public class TranscriptLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptLoader.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final KeyValueCache cache;
  private final TranscriptProvider provider;

  public TranscriptLoader(KeyValueCache cache, TranscriptProvider provider) {
    this.cache = cache;
    this.provider = provider;
  }

  /**
   * Load the transcript of a video.
   *
   * @param videoId the video
   * @return the transcript, never blank
   * @throws TranscriptUnavailableException if the video has no usable transcript
   */
  public Transcript load(VideoId videoId) {
    String cacheKey = KeyValueCache.transcriptKey(videoId.value());

    Optional<String> cached = cache.get(cacheKey);
    if (cached.isPresent() && cached.get().isBlank()) {
      LOGGER.warn("Ignoring blank cached transcript: videoId={}", videoId);
      cached = Optional.empty();
    }
    if (cached.isPresent()) {
      structuredLogger.logTranscriptCache(videoId.value(), true, cached.get().length());
      return new Transcript(videoId, cached.get(), Transcript.Source.CACHE);
    }
    structuredLogger.logTranscriptCache(videoId.value(), false, 0);

    List<TranscriptSegment> segments = provider.fetch(videoId);
    String text = join(segments);
    if (text.isBlank()) {
      LOGGER.info("Provider returned blank transcript: videoId={}", videoId);
      throw new TranscriptUnavailableException(videoId, Reason.EMPTY);
    }

    cache.set(cacheKey, text);
    LOGGER.info(
        "Cached transcript: videoId={}, segments={}, chars={}",
        videoId,
        segments.size(),
        text.length());
    return new Transcript(videoId, text, Transcript.Source.PROVIDER);
  }

  /** Segment texts in provider order, separated by a single space. */
  static String join(List<TranscriptSegment> segments) {
    return segments.stream()
        .map(TranscriptSegment::text)
        .map(text -> text == null ? "" : text)
        .collect(Collectors.joining(" "));
  }
}
