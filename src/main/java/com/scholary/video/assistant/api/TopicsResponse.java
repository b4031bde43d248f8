package com.scholary.video.assistant.api;

public record TopicsResponse(String videoId, String topics) {}
