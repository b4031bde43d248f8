package com.scholary.video.assistant.transcript;

import java.util.List;

/** Response body of the transcript provider. */
public record TranscriptProviderResponse(List<TranscriptSegment> segments) {}
