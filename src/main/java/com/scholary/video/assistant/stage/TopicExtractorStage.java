package com.scholary.video.assistant.stage;

import com.scholary.video.assistant.generation.GenerationBackend;
import org.springframework.stereotype.Component;

/** Main topics of the transcript, with approximate times where derivable. */
@Component
public class TopicExtractorStage implements DerivationStage<Void, String> {

  private final GenerationBackend backend;
  private final PromptBuilder prompts;

  public TopicExtractorStage(GenerationBackend backend, PromptBuilder prompts) {
    this.backend = backend;
    this.prompts = prompts;
  }

  @Override
  public String name() {
    return "topic_extractor";
  }

  @Override
  public String derive(StageInput<Void> input) {
    return backend.complete(prompts.topics(input.text()));
  }
}
