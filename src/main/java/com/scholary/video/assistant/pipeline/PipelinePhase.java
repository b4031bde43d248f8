package com.scholary.video.assistant.pipeline;

/** Phases of one pipeline run. Any phase may move to {@link #FAILED}. */
public enum PipelinePhase {
  START,
  LOAD_TRANSCRIPT,
  RUN_STAGES,
  DONE,
  FAILED
}
