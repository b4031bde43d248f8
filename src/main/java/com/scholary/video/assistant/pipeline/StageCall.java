package com.scholary.video.assistant.pipeline;

import com.scholary.video.assistant.stage.DerivationStage;
import java.util.Objects;

/** A stage together with the parameters it should run with. */
public record StageCall<P, O>(DerivationStage<P, O> stage, P parameters) {

  public StageCall {
    Objects.requireNonNull(stage, "stage");
  }

  public static <O> StageCall<Void, O> of(DerivationStage<Void, O> stage) {
    return new StageCall<>(stage, null);
  }

  public static <P, O> StageCall<P, O> of(DerivationStage<P, O> stage, P parameters) {
    return new StageCall<>(stage, parameters);
  }
}
