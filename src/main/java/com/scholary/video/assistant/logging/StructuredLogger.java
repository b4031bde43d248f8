package com.scholary.video.assistant.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log events with structured fields that can be queried in the log index.
 * Transcript text and quiz answers are never put into a log line; only sizes and counts are.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log transcript cache lookup. */
  public void logTranscriptCache(String videoId, boolean hit, int chars) {
    try {
      MDC.put("event_type", "transcript_cache");
      MDC.put("cacheHit", String.valueOf(hit));
      MDC.put("chars", String.valueOf(chars));

      logger.debug(
          "Transcript cache {}: videoId={}, chars={}", hit ? "hit" : "miss", videoId, chars);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage started event. */
  public void logStageStarted(String stage, String videoId, int transcriptChars) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage);
      MDC.put("chars", String.valueOf(transcriptChars));

      logger.debug(
          "Stage started: stage={}, videoId={}, transcriptChars={}",
          stage,
          videoId,
          transcriptChars);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage finished event. */
  public void logStageFinished(String stage, String videoId, long elapsedMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("stage", stage);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Stage finished: stage={}, videoId={}, elapsed={}ms", stage, videoId, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage failure event. */
  public void logStageFailed(String stage, String videoId, String errorType, String message) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("stage", stage);
      MDC.put("errorType", errorType);

      logger.warn(
          "Stage failed: stage={}, videoId={}, error={}, message={}",
          stage,
          videoId,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log quiz generated event. */
  public void logQuizGenerated(String quizId, String videoId, String difficulty, int questions) {
    try {
      MDC.put("event_type", "quiz_generated");
      MDC.put("quizId", quizId);
      MDC.put("questions", String.valueOf(questions));

      logger.info(
          "Quiz generated: quizId={}, videoId={}, difficulty={}, questions={}",
          quizId,
          videoId,
          difficulty,
          questions);
    } finally {
      clearEventFields();
    }
  }

  /** Log quiz verified event. */
  public void logQuizVerified(String quizId, int correct, int total, int submitted) {
    try {
      MDC.put("event_type", "quiz_verified");
      MDC.put("quizId", quizId);
      MDC.put("questions", String.valueOf(total));

      logger.info(
          "Quiz verified: quizId={}, correct={}/{}, submitted={}",
          quizId,
          correct,
          total,
          submitted);
    } finally {
      clearEventFields();
    }
  }

  /** Set request context in MDC. */
  public static void setRequestContext(String correlationId, String videoId) {
    MDC.put("correlationId", correlationId);
    MDC.put("videoId", videoId);
  }

  /** Clear request context from MDC. */
  public static void clearRequestContext() {
    MDC.remove("correlationId");
    MDC.remove("videoId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("cacheHit");
    MDC.remove("chars");
    MDC.remove("stage");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("quizId");
    MDC.remove("questions");
  }
}
