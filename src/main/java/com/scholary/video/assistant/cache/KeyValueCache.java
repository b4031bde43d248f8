package com.scholary.video.assistant.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * String key-value store shared by every request.
 *
 * <p>Holds two kinds of entries under a flat key namespace:
 *
 * <ul>
 *   <li>{@code transcript:{videoId}} - transcript text, no expiry
 *   <li>{@code quiz:{quizId}} - full answer key of a generated quiz, fixed expiry
 * </ul>
 *
 * <p>Implementations must be safe for concurrent use; atomic per-key get/set is all that is
 * required. An unreachable store raises {@link CacheUnavailableException} and is never reported
 * as a miss.
 */
public interface KeyValueCache {

  /**
   * Look up a value.
   *
   * @param key the cache key
   * @return the stored value, or empty if absent or expired
   * @throws CacheUnavailableException if the store cannot be reached
   */
  Optional<String> get(String key);

  /**
   * Store a value that persists until explicitly evicted.
   *
   * @param key the cache key
   * @param value the value to store
   * @throws CacheUnavailableException if the store cannot be reached
   */
  void set(String key, String value);

  /**
   * Store a value that becomes unreadable once {@code ttl} has elapsed.
   *
   * @param key the cache key
   * @param value the value to store
   * @param ttl time to live, must be positive
   * @throws CacheUnavailableException if the store cannot be reached
   */
  void set(String key, String value, Duration ttl);

  /**
   * Remove an entry if present.
   *
   * @param key the cache key
   */
  void evict(String key);

  /** Key under which the transcript of a video is stored. */
  static String transcriptKey(String videoId) {
    return "transcript:" + videoId;
  }

  /** Key under which the answer key of a quiz is stored. */
  static String quizKey(String quizId) {
    return "quiz:" + quizId;
  }
}
