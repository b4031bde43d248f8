package com.scholary.video.assistant.api;

import jakarta.validation.constraints.NotBlank;

/** Free-form question about a video. */
public record ChatRequest(String videoUrl, String videoId, @NotBlank String question) {}
