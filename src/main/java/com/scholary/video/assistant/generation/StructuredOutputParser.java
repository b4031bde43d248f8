package com.scholary.video.assistant.generation;

/** Converts a raw completion into a validated typed object. */
@FunctionalInterface
public interface StructuredOutputParser<T> {

  /**
   * @param raw the completion text
   * @return the parsed value, never partial
   * @throws GenerationException if the completion does not match the expected schema
   */
  T parse(String raw);
}
