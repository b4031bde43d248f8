package com.scholary.video.assistant.transcript;

import com.scholary.video.assistant.error.InvalidInputException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical 11-character identifier of a video, independent of URL form.
 *
 * <p>Invalid input is rejected, never coerced.
 */
public record VideoId(String value) {

  private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{11}");

  // watch?v=ID, youtu.be/ID, /shorts/ID, /embed/ID
  private static final Pattern URL_PATTERN =
      Pattern.compile(
          "(?:[?&]v=|youtu\\.be/|/shorts/|/embed/)([A-Za-z0-9_-]{11})(?![A-Za-z0-9_-])");

  public VideoId {
    if (value == null || !ID_PATTERN.matcher(value).matches()) {
      throw new InvalidInputException("Invalid video id: " + value);
    }
  }

  public static VideoId of(String value) {
    return new VideoId(value == null ? null : value.trim());
  }

  /**
   * Extract the identifier from a video URL.
   *
   * @param url the video URL
   * @return the identifier
   * @throws InvalidInputException if no identifier can be found
   */
  public static VideoId fromUrl(String url) {
    if (url == null || url.isBlank()) {
      throw new InvalidInputException("Video URL is empty");
    }
    Matcher matcher = URL_PATTERN.matcher(url);
    if (!matcher.find()) {
      throw new InvalidInputException("Invalid video URL: " + url);
    }
    return new VideoId(matcher.group(1));
  }

  /**
   * Resolve an identifier from a request that carries an id, a URL, or both. An explicit id wins.
   *
   * @throws InvalidInputException if neither is present or the chosen one is malformed
   */
  public static VideoId resolve(String videoId, String videoUrl) {
    if (videoId != null && !videoId.isBlank()) {
      return of(videoId);
    }
    if (videoUrl != null && !videoUrl.isBlank()) {
      return fromUrl(videoUrl);
    }
    throw new InvalidInputException("Either video_id or video_url must be provided.");
  }

  @Override
  public String toString() {
    return value;
  }
}
