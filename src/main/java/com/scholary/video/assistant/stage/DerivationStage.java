package com.scholary.video.assistant.stage;

/**
 * One independent transform of a transcript into derived output.
 *
 * <p>A stage sees only its own {@link StageInput}: the shared transcript plus the parameters it
 * was given. It must not assume that repeated calls produce the same output.
 *
 * @param <P> parameter type, {@link Void} when the stage takes none
 * @param <O> output type
 */
public interface DerivationStage<P, O> {

  /** Stable name used for logging and for keying results. */
  String name();

  /**
   * Derive output from the transcript.
   *
   * @param input the transcript and stage parameters
   * @return the stage output, never partial
   */
  O derive(StageInput<P> input);
}
