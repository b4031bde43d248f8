package com.scholary.video.assistant.api;

import com.scholary.video.assistant.quiz.Difficulty;
import com.scholary.video.assistant.quiz.QuizLifecycleManager;
import com.scholary.video.assistant.quiz.QuizParameters;
import com.scholary.video.assistant.quiz.RedactedQuiz;
import com.scholary.video.assistant.quiz.VerificationResult;
import com.scholary.video.assistant.service.VideoAssistantService;
import com.scholary.video.assistant.transcript.Transcript;
import com.scholary.video.assistant.transcript.VideoId;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for transcript-backed video assistance.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Fetching a transcript
 *   <li>Summaries, topic lists and free-form Q&amp;A
 *   <li>Generating a quiz and verifying answers against it
 * </ul>
 *
 * <p>Failures are translated by {@link ApiExceptionHandler}.
 */
@RestController
@Tag(name = "Video assistant", description = "Transcript, summary, topics, chat and quiz API")
public class VideoAssistantController {

  private static final Logger LOGGER = LoggerFactory.getLogger(VideoAssistantController.class);

  private final VideoAssistantService assistantService;
  private final QuizLifecycleManager quizManager;

  public VideoAssistantController(
      VideoAssistantService assistantService, QuizLifecycleManager quizManager) {
    this.assistantService = assistantService;
    this.quizManager = quizManager;
  }

  @GetMapping("/")
  @Operation(summary = "Liveness", description = "Report that the service is running")
  public Map<String, String> root() {
    return Map.of("message", "Video assistant backend is running.");
  }

  @PostMapping("/transcript")
  @Operation(summary = "Get transcript", description = "Return the transcript of a video")
  public ResponseEntity<TranscriptResponse> transcript(@RequestBody VideoRequest request) {
    VideoId videoId = VideoId.resolve(request.videoId(), request.videoUrl());
    LOGGER.info("Transcript request: videoId={}", videoId);

    Transcript transcript = assistantService.loadTranscript(videoId);
    return ResponseEntity.ok(
        new TranscriptResponse(videoId.value(), transcript.text(), transcript.cached()));
  }

  @PostMapping("/generate-summary")
  @Operation(summary = "Summarize", description = "Summarize the transcript of a video")
  public ResponseEntity<SummaryResponse> summary(@RequestBody VideoRequest request) {
    VideoId videoId = VideoId.resolve(request.videoId(), request.videoUrl());
    LOGGER.info("Summary request: videoId={}", videoId);

    return ResponseEntity.ok(
        new SummaryResponse(videoId.value(), assistantService.summarize(videoId)));
  }

  @PostMapping("/generate-topics")
  @Operation(summary = "Extract topics", description = "List the main topics of a video")
  public ResponseEntity<TopicsResponse> topics(@RequestBody VideoRequest request) {
    VideoId videoId = VideoId.resolve(request.videoId(), request.videoUrl());
    LOGGER.info("Topics request: videoId={}", videoId);

    return ResponseEntity.ok(
        new TopicsResponse(videoId.value(), assistantService.extractTopics(videoId)));
  }

  @PostMapping("/chat")
  @Operation(summary = "Ask a question", description = "Answer a question from the transcript")
  public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
    VideoId videoId = VideoId.resolve(request.videoId(), request.videoUrl());
    LOGGER.info("Chat request: videoId={}", videoId);

    return ResponseEntity.ok(
        new ChatResponse(
            videoId.value(), assistantService.answerQuestion(videoId, request.question())));
  }

  @PostMapping("/generate-quiz")
  @Operation(
      summary = "Generate quiz",
      description = "Generate a multiple-choice quiz; answers are kept server-side")
  public ResponseEntity<QuizResponse> generateQuiz(@Valid @RequestBody QuizRequest request) {
    VideoId videoId = VideoId.resolve(request.videoId(), request.videoUrl());
    QuizParameters parameters =
        new QuizParameters(Difficulty.parse(request.difficulty()), request.numQuestions());
    LOGGER.info(
        "Quiz request: videoId={}, difficulty={}, questions={}",
        videoId,
        parameters.difficulty().label(),
        parameters.questionCount());

    RedactedQuiz quiz = quizManager.generate(videoId, parameters);
    return ResponseEntity.ok(QuizResponse.from(quiz));
  }

  @PostMapping("/verify-answers")
  @Operation(
      summary = "Verify answers",
      description = "Check submitted option indices against a generated quiz")
  public ResponseEntity<VerifyAnswersResponse> verifyAnswers(
      @Valid @RequestBody VerifyAnswersRequest request) {
    LOGGER.info("Verify request: quizId={}", request.quizId());

    VerificationResult result = quizManager.verify(request.quizId(), request.userAnswers());
    return ResponseEntity.ok(VerifyAnswersResponse.from(result));
  }
}
