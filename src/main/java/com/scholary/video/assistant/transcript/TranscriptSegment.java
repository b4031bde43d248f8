package com.scholary.video.assistant.transcript;

/**
 * A single timed caption segment as returned by the transcript provider.
 *
 * <p>{@code start} and {@code duration} are in seconds.
 */
public record TranscriptSegment(String text, double start, double duration) {}
