package com.scholary.video.assistant.api;

public record ChatResponse(String videoId, String answer) {}
