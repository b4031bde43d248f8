package com.scholary.video.assistant.service;

import com.scholary.video.assistant.error.InvalidInputException;
import com.scholary.video.assistant.pipeline.PipelineOrchestrator;
import com.scholary.video.assistant.stage.QuestionAnswerStage;
import com.scholary.video.assistant.stage.SummarizerStage;
import com.scholary.video.assistant.stage.TopicExtractorStage;
import com.scholary.video.assistant.transcript.Transcript;
import com.scholary.video.assistant.transcript.VideoId;
import org.springframework.stereotype.Service;

/**
 * Transcript-backed operations that return free text.
 *
 * <p>Each operation loads the transcript through the orchestrator and runs exactly one stage.
 * Quiz operations live in {@link com.scholary.video.assistant.quiz.QuizLifecycleManager}.
 */
@Service
public class VideoAssistantService {

  private final PipelineOrchestrator orchestrator;
  private final SummarizerStage summarizer;
  private final TopicExtractorStage topicExtractor;
  private final QuestionAnswerStage questionAnswer;

  public VideoAssistantService(
      PipelineOrchestrator orchestrator,
      SummarizerStage summarizer,
      TopicExtractorStage topicExtractor,
      QuestionAnswerStage questionAnswer) {
    this.orchestrator = orchestrator;
    this.summarizer = summarizer;
    this.topicExtractor = topicExtractor;
    this.questionAnswer = questionAnswer;
  }

  public Transcript loadTranscript(VideoId videoId) {
    return orchestrator.loadTranscript(videoId);
  }

  public String summarize(VideoId videoId) {
    return orchestrator.run(videoId, summarizer, null);
  }

  public String extractTopics(VideoId videoId) {
    return orchestrator.run(videoId, topicExtractor, null);
  }

  public String answerQuestion(VideoId videoId, String question) {
    if (question == null || question.isBlank()) {
      throw new InvalidInputException("Question must not be blank");
    }
    return orchestrator.run(videoId, questionAnswer, question);
  }
}
