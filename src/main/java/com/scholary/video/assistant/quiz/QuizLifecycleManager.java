package com.scholary.video.assistant.quiz;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.video.assistant.cache.CacheUnavailableException;
import com.scholary.video.assistant.cache.KeyValueCache;
import com.scholary.video.assistant.config.AssistantProperties;
import com.scholary.video.assistant.error.InvalidInputException;
import com.scholary.video.assistant.logging.StructuredLogger;
import com.scholary.video.assistant.pipeline.PipelineOrchestrator;
import com.scholary.video.assistant.stage.QuizGeneratorStage;
import com.scholary.video.assistant.transcript.VideoId;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Generates quizzes and verifies submissions without ever handing out the answers.
 *
 * <p>At generation time the full quiz is stored under {@code quiz:{quizId}} with a fixed time to
 * live and only the redacted view is returned. At verification time the stored quiz is read back
 * and compared against the submitted option indices; only booleans leave this class. The stored
 * entry is never rewritten or extended, it simply expires.
 */
@Service
public class QuizLifecycleManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(QuizLifecycleManager.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final PipelineOrchestrator orchestrator;
  private final QuizGeneratorStage quizGenerator;
  private final KeyValueCache cache;
  private final ObjectMapper objectMapper;
  private final Duration ttl;
  private final int maxQuestions;

  public QuizLifecycleManager(
      PipelineOrchestrator orchestrator,
      QuizGeneratorStage quizGenerator,
      KeyValueCache cache,
      ObjectMapper objectMapper,
      AssistantProperties properties) {
    this.orchestrator = orchestrator;
    this.quizGenerator = quizGenerator;
    this.cache = cache;
    this.objectMapper = objectMapper;
    this.ttl = properties.quiz().ttl();
    this.maxQuestions = properties.quiz().maxQuestions();
  }

  /**
   * Generate a quiz for a video.
   *
   * <p>If generation fails nothing is stored and no quiz id is handed out.
   *
   * @param videoId the video
   * @param parameters difficulty and question count
   * @return the quiz id and answer-free questions
   */
  public RedactedQuiz generate(VideoId videoId, QuizParameters parameters) {
    if (parameters.questionCount() > maxQuestions) {
      throw new InvalidInputException(
          String.format(
              "Question count must be at most %d: %d", maxQuestions, parameters.questionCount()));
    }

    List<QuizQuestion> questions = orchestrator.run(videoId, quizGenerator, parameters);

    Quiz quiz =
        new Quiz(
            UUID.randomUUID().toString(),
            videoId.value(),
            parameters.difficulty().label(),
            questions);
    cache.set(KeyValueCache.quizKey(quiz.quizId()), serialize(quiz), ttl);

    structuredLogger.logQuizGenerated(
        quiz.quizId(), videoId.value(), quiz.difficulty(), questions.size());
    return quiz.redact();
  }

  /**
   * Check submitted answers against the stored answer key.
   *
   * <p>{@code answers[i]} is the zero-based option index chosen for question {@code i}. Missing or
   * null entries count as wrong; entries beyond the last question are ignored.
   *
   * @param quizId the quiz id returned by {@link #generate}
   * @param answers the submitted option indices
   * @return one boolean per question
   * @throws QuizNotFoundException if the quiz was never generated or has expired
   */
  public VerificationResult verify(String quizId, List<Integer> answers) {
    if (quizId == null || quizId.isBlank()) {
      throw new InvalidInputException("Quiz id is required");
    }
    List<Integer> submitted = answers == null ? List.of() : answers;

    Quiz quiz =
        cache
            .get(KeyValueCache.quizKey(quizId))
            .map(this::deserialize)
            .orElseThrow(() -> new QuizNotFoundException(quizId));

    List<Boolean> results = new ArrayList<>(quiz.questions().size());
    for (int i = 0; i < quiz.questions().size(); i++) {
      Integer answer = i < submitted.size() ? submitted.get(i) : null;
      results.add(answer != null && answer == quiz.questions().get(i).correctIndex());
    }

    VerificationResult result = new VerificationResult(quizId, results);
    structuredLogger.logQuizVerified(quizId, result.correct(), result.total(), submitted.size());
    return result;
  }

  private String serialize(Quiz quiz) {
    try {
      return objectMapper.writeValueAsString(quiz);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize quiz " + quiz.quizId(), e);
    }
  }

  private Quiz deserialize(String json) {
    try {
      return objectMapper.readValue(json, Quiz.class);
    } catch (JsonProcessingException e) {
      throw new CacheUnavailableException("Stored quiz is unreadable", e);
    }
  }
}
