package com.scholary.video.assistant.api;

/**
 * Request naming a video by id or by URL.
 *
 * <p>An explicit id wins over the URL.
 */
public record VideoRequest(String videoUrl, String videoId) {}
