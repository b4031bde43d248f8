package com.scholary.video.assistant.pipeline;

import com.scholary.video.assistant.logging.StructuredLogger;
import com.scholary.video.assistant.stage.DerivationStage;
import com.scholary.video.assistant.stage.StageInput;
import com.scholary.video.assistant.transcript.Transcript;
import com.scholary.video.assistant.transcript.TranscriptLoader;
import com.scholary.video.assistant.transcript.VideoId;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs derivation stages against a video's transcript.
 *
 * <p>Per request: {@code START -> LOAD_TRANSCRIPT -> RUN_STAGES -> DONE}, and any failure moves
 * to {@code FAILED}. The transcript is loaded once and shared by every requested stage. Stages run
 * one after another on the calling thread; the first failure aborts the run and nothing produced
 * so far is returned.
 *
 * <p>Holds no state between requests.
 */
@Service
public class PipelineOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final String TRANSCRIPT_LOADER = "transcript_loader";

  private final TranscriptLoader transcriptLoader;

  public PipelineOrchestrator(TranscriptLoader transcriptLoader) {
    this.transcriptLoader = transcriptLoader;
  }

  /**
   * Load the transcript only.
   *
   * @param videoId the video
   * @return the transcript
   */
  public Transcript loadTranscript(VideoId videoId) {
    return inPipeline(videoId, List.of(), transcript -> transcript);
  }

  /**
   * Run a single stage.
   *
   * @return the stage output
   */
  public <P, O> O run(VideoId videoId, DerivationStage<P, O> stage, P parameters) {
    return inPipeline(
        videoId, List.of(stage.name()), transcript -> runStage(stage, parameters, transcript));
  }

  /**
   * Run several stages against one transcript load.
   *
   * @param videoId the video
   * @param calls stages to run, each at most once
   * @return every stage output, or an exception if any step failed
   */
  public PipelineResult execute(VideoId videoId, List<StageCall<?, ?>> calls) {
    List<String> stageNames = distinctStageNames(calls);

    return inPipeline(
        videoId,
        stageNames,
        transcript -> {
          PipelineResult.Builder result = PipelineResult.builder(transcript);
          for (StageCall<?, ?> call : calls) {
            result.add(call.stage().name(), runStage(call, transcript));
          }
          return result.build();
        });
  }

  private <R> R inPipeline(
      VideoId videoId, List<String> stageNames, Function<Transcript, R> stages) {
    String correlationId = UUID.randomUUID().toString();
    StructuredLogger.setRequestContext(correlationId, videoId.value());
    PipelinePhase phase = PipelinePhase.START;

    try {
      LOGGER.info("Starting pipeline: videoId={}, stages={}", videoId, stageNames);

      phase = advance(phase, PipelinePhase.LOAD_TRANSCRIPT);
      Transcript transcript = transcriptLoader.load(videoId);

      phase = advance(phase, PipelinePhase.RUN_STAGES);
      R result = stages.apply(transcript);

      advance(phase, PipelinePhase.DONE);
      return result;

    } catch (RuntimeException e) {
      if (phase == PipelinePhase.LOAD_TRANSCRIPT) {
        structuredLogger.logStageFailed(
            TRANSCRIPT_LOADER, videoId.value(), e.getClass().getSimpleName(), e.getMessage());
      }
      advance(phase, PipelinePhase.FAILED);
      throw e;
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  private <P, O> O runStage(StageCall<P, O> call, Transcript transcript) {
    return runStage(call.stage(), call.parameters(), transcript);
  }

  private <P, O> O runStage(DerivationStage<P, O> stage, P parameters, Transcript transcript) {
    structuredLogger.logStageStarted(
        stage.name(), transcript.videoId().value(), transcript.text().length());
    long startTime = System.currentTimeMillis();

    O output;
    try {
      output = stage.derive(new StageInput<>(transcript, parameters));
    } catch (RuntimeException e) {
      structuredLogger.logStageFailed(
          stage.name(),
          transcript.videoId().value(),
          e.getClass().getSimpleName(),
          e.getMessage());
      throw e;
    }
    if (output == null) {
      throw new IllegalStateException("Stage produced no output: " + stage.name());
    }

    structuredLogger.logStageFinished(
        stage.name(), transcript.videoId().value(), System.currentTimeMillis() - startTime);
    return output;
  }

  private static PipelinePhase advance(PipelinePhase from, PipelinePhase to) {
    MDC.put("phase", to.name());
    LOGGER.debug("Pipeline phase: {} -> {}", from, to);
    if (to == PipelinePhase.DONE || to == PipelinePhase.FAILED) {
      MDC.remove("phase");
    }
    return to;
  }

  private static List<String> distinctStageNames(List<StageCall<?, ?>> calls) {
    Set<String> names = new LinkedHashSet<>();
    for (StageCall<?, ?> call : calls) {
      if (!names.add(call.stage().name())) {
        throw new IllegalArgumentException("Stage requested twice: " + call.stage().name());
      }
    }
    return List.copyOf(names);
  }
}
