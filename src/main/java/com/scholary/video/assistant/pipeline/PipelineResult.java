package com.scholary.video.assistant.pipeline;

import com.scholary.video.assistant.stage.DerivationStage;
import com.scholary.video.assistant.transcript.Transcript;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outputs of one completed pipeline run, keyed by stage name.
 *
 * <p>Assembled by the orchestrator after each stage returns and handed out only once every stage
 * has succeeded.
 */
public final class PipelineResult {

  private final Transcript transcript;
  private final Map<String, Object> outputs;

  private PipelineResult(Transcript transcript, Map<String, Object> outputs) {
    this.transcript = transcript;
    this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
  }

  public Transcript transcript() {
    return transcript;
  }

  /**
   * Output of a stage that ran in this pipeline.
   *
   * @param stage the stage
   * @param outputType the stage's output class
   * @throws IllegalArgumentException if the stage was not part of the run
   */
  public <O> O outputOf(DerivationStage<?, O> stage, Class<O> outputType) {
    Object output = outputs.get(stage.name());
    if (output == null) {
      throw new IllegalArgumentException("Stage did not run: " + stage.name());
    }
    return outputType.cast(output);
  }

  static Builder builder(Transcript transcript) {
    return new Builder(transcript);
  }

  static final class Builder {

    private final Transcript transcript;
    private final Map<String, Object> outputs = new LinkedHashMap<>();

    private Builder(Transcript transcript) {
      this.transcript = Objects.requireNonNull(transcript, "transcript");
    }

    Builder add(String stageName, Object output) {
      if (output == null) {
        throw new IllegalStateException("Stage produced no output: " + stageName);
      }
      if (outputs.putIfAbsent(stageName, output) != null) {
        throw new IllegalStateException("Stage ran twice: " + stageName);
      }
      return this;
    }

    PipelineResult build() {
      return new PipelineResult(transcript, outputs);
    }
  }
}
