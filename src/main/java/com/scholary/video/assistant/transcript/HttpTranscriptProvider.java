package com.scholary.video.assistant.transcript;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.video.assistant.transcript.TranscriptUnavailableException.Reason;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the caption sidecar service.
 *
 * <p>Protocol: {@code GET {baseUrl}/api/v1/transcripts/{videoId}} returns {@code
 * {"segments":[{"text":..,"start":..,"duration":..}]}}. A 404 means no transcript exists, a 403
 * means captions are disabled for the video. Both are final answers and are not retried.
 * Transport failures and 5xx responses are retried with exponential backoff.
 */
public class HttpTranscriptProvider implements TranscriptProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpTranscriptProvider.class);

  private final HttpClient httpClient;
  private final TranscriptProviderProperties properties;
  private final ObjectMapper objectMapper;
  private final long backoffBaseMs;

  public HttpTranscriptProvider(
      TranscriptProviderProperties properties, ObjectMapper objectMapper) {
    this(properties, objectMapper, 1000);
  }

  HttpTranscriptProvider(
      TranscriptProviderProperties properties, ObjectMapper objectMapper, long backoffBaseMs) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.backoffBaseMs = backoffBaseMs;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized transcript provider client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public List<TranscriptSegment> fetch(VideoId videoId) {
    LOGGER.info("Fetching transcript: videoId={}", videoId);

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptFetch(videoId);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TranscriptProviderException("Transcript fetch interrupted", e);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs =
              (long) (Math.pow(2, attempt) * backoffBaseMs + Math.random() * backoffBaseMs);
          LOGGER.warn(
              "Transcript fetch attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TranscriptProviderException("Transcript fetch interrupted", ie);
          }
        }
      }
    }

    throw new TranscriptProviderException(
        String.format(
            "Transcript fetch for %s failed after %d attempts", videoId, properties.maxRetries()),
        lastException);
  }

  private List<TranscriptSegment> attemptFetch(VideoId videoId)
      throws IOException, InterruptedException {

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/transcripts/" + videoId.value()))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Accept", "application/json")
            .GET()
            .build();

    LOGGER.debug("Sending transcript request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    switch (response.statusCode()) {
      case 200:
        break;
      case 403:
        throw new TranscriptUnavailableException(videoId, Reason.DISABLED);
      case 404:
        throw new TranscriptUnavailableException(videoId, Reason.NOT_FOUND);
      default:
        if (response.statusCode() >= 500) {
          throw new IOException(
              String.format(
                  "Transcript provider returned status %d: %s",
                  response.statusCode(), response.body()));
        }
        throw new TranscriptProviderException(
            String.format(
                "Transcript provider rejected request with status %d: %s",
                response.statusCode(), response.body()));
    }

    TranscriptProviderResponse body;
    try {
      body = objectMapper.readValue(response.body(), TranscriptProviderResponse.class);
    } catch (IOException e) {
      throw new TranscriptProviderException("Malformed transcript provider response", e);
    }
    if (body == null
        || (body.segments() != null && body.segments().stream().anyMatch(Objects::isNull))) {
      throw new TranscriptProviderException("Malformed transcript provider response");
    }
    List<TranscriptSegment> segments = body.segments() == null ? List.of() : body.segments();

    LOGGER.info("Transcript fetched: videoId={}, segments={}", videoId, segments.size());
    return segments;
  }
}
