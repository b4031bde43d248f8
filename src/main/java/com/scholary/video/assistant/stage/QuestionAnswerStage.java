package com.scholary.video.assistant.stage;

import com.scholary.video.assistant.generation.GenerationBackend;
import java.util.Objects;
import org.springframework.stereotype.Component;

/** Short answer to a caller question, grounded only in the transcript. */
@Component
public class QuestionAnswerStage implements DerivationStage<String, String> {

  private final GenerationBackend backend;
  private final PromptBuilder prompts;

  public QuestionAnswerStage(GenerationBackend backend, PromptBuilder prompts) {
    this.backend = backend;
    this.prompts = prompts;
  }

  @Override
  public String name() {
    return "qna_agent";
  }

  @Override
  public String derive(StageInput<String> input) {
    String question = Objects.requireNonNull(input.parameters(), "question");
    return backend.complete(prompts.answer(input.text(), question.trim()));
  }
}
