package com.scholary.video.assistant.stage;

import com.scholary.video.assistant.generation.GenerationBackend;
import org.springframework.stereotype.Component;

/** Free-form summary of the transcript. */
@Component
public class SummarizerStage implements DerivationStage<Void, String> {

  private final GenerationBackend backend;
  private final PromptBuilder prompts;

  public SummarizerStage(GenerationBackend backend, PromptBuilder prompts) {
    this.backend = backend;
    this.prompts = prompts;
  }

  @Override
  public String name() {
    return "summarizer";
  }

  @Override
  public String derive(StageInput<Void> input) {
    return backend.complete(prompts.summary(input.text()));
  }
}
