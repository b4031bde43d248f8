package com.scholary.video.assistant.quiz;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.video.assistant.generation.StructuredOutputParser;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses a quiz completion into validated {@link QuizQuestion}s.
 *
 * <p>Accepted shapes: a JSON array of question objects, or an object with a {@code questions}
 * array, optionally wrapped in a markdown code fence. Each question needs {@code question} (or
 * {@code prompt}), {@code options} with exactly four distinct strings, and {@code answer} (or
 * {@code correct_option}) equal to one of the options.
 *
 * <p>All or nothing: one bad question, or a question count other than the one requested, rejects
 * the whole completion.
 */
public class QuizResponseParser implements StructuredOutputParser<List<QuizQuestion>> {

  private final ObjectMapper objectMapper;
  private final int expectedCount;

  public QuizResponseParser(ObjectMapper objectMapper, int expectedCount) {
    this.objectMapper = objectMapper;
    this.expectedCount = expectedCount;
  }

  @Override
  public List<QuizQuestion> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new QuizFormatException("Quiz completion is empty");
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(extractJson(raw));
    } catch (JsonProcessingException e) {
      throw new QuizFormatException("Quiz completion is not valid JSON", e);
    }

    JsonNode items = root.isObject() ? root.get("questions") : root;
    if (items == null || !items.isArray()) {
      throw new QuizFormatException("Quiz completion has no question list");
    }
    if (items.size() != expectedCount) {
      throw new QuizFormatException(
          String.format("Expected %d questions, got %d", expectedCount, items.size()));
    }

    List<QuizQuestion> questions = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      questions.add(toQuestion(i, items.get(i)));
    }
    return questions;
  }

  private QuizQuestion toQuestion(int index, JsonNode item) {
    if (!item.isObject()) {
      throw new QuizFormatException("Question " + index + " is not an object");
    }

    String prompt = text(item, "question", "prompt");
    String answer = text(item, "answer", "correct_option");
    JsonNode optionsNode = item.get("options");
    if (prompt == null || answer == null || optionsNode == null || !optionsNode.isArray()) {
      throw new QuizFormatException(
          "Question " + index + " must have question, options and answer fields");
    }

    List<String> options = new ArrayList<>(optionsNode.size());
    for (JsonNode option : optionsNode) {
      if (!option.isTextual()) {
        throw new QuizFormatException("Question " + index + " has a non-text option");
      }
      options.add(option.asText().trim());
    }

    try {
      return new QuizQuestion(prompt.trim(), options, answer.trim());
    } catch (IllegalArgumentException e) {
      throw new QuizFormatException("Question " + index + " is invalid: " + e.getMessage(), e);
    }
  }

  private static String text(JsonNode item, String name, String alias) {
    JsonNode node = item.has(name) ? item.get(name) : item.get(alias);
    return node != null && node.isTextual() ? node.asText() : null;
  }

  /** Strip a surrounding code fence or prose and keep the outermost JSON value. */
  static String extractJson(String raw) {
    int arrayStart = raw.indexOf('[');
    int objectStart = raw.indexOf('{');
    int start;
    char close;
    if (arrayStart >= 0 && (objectStart < 0 || arrayStart < objectStart)) {
      start = arrayStart;
      close = ']';
    } else if (objectStart >= 0) {
      start = objectStart;
      close = '}';
    } else {
      return raw;
    }
    int end = raw.lastIndexOf(close);
    return end > start ? raw.substring(start, end + 1) : raw.substring(start);
  }
}
