package com.scholary.video.assistant.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for an OpenAI-compatible chat-completions endpoint.
 *
 * <p>One request per call, no retries: the backend is rate-limited and every call costs money,
 * so retry policy is left to the caller.
 */
public class OpenAiGenerationClient implements GenerationBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiGenerationClient.class);

  private static final String SYSTEM_PROMPT =
      "You are an educational assistant that answers strictly from the video transcript you are"
          + " given.";

  private final HttpClient httpClient;
  private final GenerationProperties properties;
  private final ObjectMapper objectMapper;

  public OpenAiGenerationClient(GenerationProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized generation client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  @Override
  public String complete(String instruction) {
    LOGGER.debug(
        "Sending completion request: model={}, chars={}", properties.model(), instruction.length());

    HttpResponse<String> response;
    try {
      response = httpClient.send(buildRequest(instruction), HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new GenerationException("Generation backend unreachable: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GenerationException("Generation request interrupted", e);
    }

    if (response.statusCode() != 200) {
      throw new GenerationException(
          String.format(
              "Generation backend returned status %d: %s", response.statusCode(), response.body()));
    }

    String content;
    try {
      JsonNode root = objectMapper.readTree(response.body());
      content = root.at("/choices/0/message/content").asText("");
    } catch (IOException e) {
      throw new GenerationException("Malformed generation backend response", e);
    }

    if (content.isBlank()) {
      throw new GenerationException("Generation backend returned an empty completion");
    }

    LOGGER.debug("Completion received: chars={}", content.length());
    return content;
  }

  private HttpRequest buildRequest(String instruction) throws IOException {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", properties.model());
    body.put("max_tokens", properties.maxTokens());
    body.put("temperature", properties.temperature());

    ArrayNode messages = body.putArray("messages");
    ObjectNode systemMsg = messages.addObject();
    systemMsg.put("role", "system");
    systemMsg.put("content", SYSTEM_PROMPT);
    ObjectNode userMsg = messages.addObject();
    userMsg.put("role", "user");
    userMsg.put("content", instruction);

    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/v1/chat/completions"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));

    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.apiKey());
    }
    return builder.build();
  }
}
