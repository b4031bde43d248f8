package com.scholary.video.assistant.api;

public record SummaryResponse(String videoId, String summary) {}
