package com.scholary.video.assistant.stage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.video.assistant.generation.GenerationBackend;
import com.scholary.video.assistant.quiz.QuizParameters;
import com.scholary.video.assistant.quiz.QuizQuestion;
import com.scholary.video.assistant.quiz.QuizResponseParser;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Multiple-choice questions with answers.
 *
 * <p>The completion must validate completely; a malformed one fails the stage with {@link
 * com.scholary.video.assistant.quiz.QuizFormatException} instead of yielding a partial quiz.
 */
@Component
public class QuizGeneratorStage implements DerivationStage<QuizParameters, List<QuizQuestion>> {

  private final GenerationBackend backend;
  private final PromptBuilder prompts;
  private final ObjectMapper objectMapper;

  public QuizGeneratorStage(
      GenerationBackend backend, PromptBuilder prompts, ObjectMapper objectMapper) {
    this.backend = backend;
    this.prompts = prompts;
    this.objectMapper = objectMapper;
  }

  @Override
  public String name() {
    return "quiz_generator";
  }

  @Override
  public List<QuizQuestion> derive(StageInput<QuizParameters> input) {
    QuizParameters parameters = input.parameters();
    return backend.complete(
        prompts.quiz(input.text(), parameters),
        new QuizResponseParser(objectMapper, parameters.questionCount()));
  }
}
