package com.scholary.video.assistant.api;

/** Transcript of a video and whether it was served from cache. */
public record TranscriptResponse(String videoId, String transcript, boolean cached) {}
