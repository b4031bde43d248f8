package com.scholary.video.assistant.quiz;

import com.scholary.video.assistant.error.InvalidInputException;
import java.util.Arrays;
import java.util.Locale;

/** Difficulty levels a quiz can be generated at. */
public enum Difficulty {
  EASY,
  MEDIUM,
  HARD;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parse a level name, ignoring case.
   *
   * @throws InvalidInputException for anything outside the closed set
   */
  public static Difficulty parse(String value) {
    if (value == null) {
      throw new InvalidInputException("Difficulty is required");
    }
    return Arrays.stream(values())
        .filter(level -> level.name().equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidInputException(
                    "Invalid difficulty '" + value + "', expected one of easy, medium, hard"));
  }
}
