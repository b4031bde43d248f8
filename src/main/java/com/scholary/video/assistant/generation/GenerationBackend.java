package com.scholary.video.assistant.generation;

/**
 * Text-completion backend used by every derivation stage.
 *
 * <p>Implementations are blocking. Output is not assumed to be reproducible across calls.
 */
public interface GenerationBackend {

  /**
   * Complete an instruction.
   *
   * @param instruction the full prompt
   * @return the raw completion text
   * @throws GenerationException if the backend fails or returns nothing
   */
  String complete(String instruction);

  /**
   * Complete an instruction and validate the completion as a typed object.
   *
   * @param instruction the full prompt
   * @param parser converts and validates the raw completion
   * @return the parsed object
   * @throws GenerationException if the backend fails or the completion does not validate
   */
  default <T> T complete(String instruction, StructuredOutputParser<T> parser) {
    return parser.parse(complete(instruction));
  }
}
