package com.scholary.video.assistant.api;

/** Error body returned for every failed request. */
public record ApiError(String error, String errorCode, int status, String timestamp) {}
