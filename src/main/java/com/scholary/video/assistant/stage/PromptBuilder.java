package com.scholary.video.assistant.stage;

import com.scholary.video.assistant.quiz.QuizParameters;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds the deterministic instruction for each stage.
 *
 * <p>Transcripts longer than {@code assistant.prompt.max-transcript-chars} are cut before being
 * embedded; 0 disables the limit.
 */
@Component
public class PromptBuilder {

  static final String TRUNCATION_MARKER = "\n[... transcript truncated ...]";

  private final int maxTranscriptChars;

  public PromptBuilder(
      @Value("${assistant.prompt.max-transcript-chars:0}") int maxTranscriptChars) {
    this.maxTranscriptChars = maxTranscriptChars;
  }

  public String summary(String transcript) {
    return """
        Summarize the following video transcript in a few clear paragraphs.
        Cover the main points in the order they are presented and do not add information that is not in the transcript.

        --- TRANSCRIPT ---
        %s
        --- END ---
        """
        .formatted(fit(transcript));
  }

  public String topics(String transcript) {
    return """
        Extract the main topics discussed in the following video transcript.
        List one topic per line with a short description. Where the transcript content allows it, \
        prefix each topic with its approximate time in the video (mm:ss).

        --- TRANSCRIPT ---
        %s
        --- END ---
        """
        .formatted(fit(transcript));
  }

  public String answer(String transcript, String question) {
    return """
        Answer the question using only the video transcript below.
        Be brief: one to three sentences. If the transcript does not contain the answer, say so.

        --- TRANSCRIPT ---
        %s
        --- END ---

        Question: %s
        """
        .formatted(fit(transcript), question);
  }

  public String quiz(String transcript, QuizParameters parameters) {
    return """
        Generate exactly %d %s level multiple-choice quiz questions from the following transcript.
        Each question must have 1 correct answer and 3 plausible distractors.

        Return ONLY a JSON array, no prose and no code fence. Each element must be an object with keys:
          "question": the question text,
          "options": a list of exactly 4 distinct option strings,
          "answer": the correct option, copied exactly from "options".

        --- TRANSCRIPT ---
        %s
        --- END ---
        """
        .formatted(parameters.questionCount(), parameters.difficulty().label(), fit(transcript));
  }

  String fit(String transcript) {
    if (maxTranscriptChars <= 0 || transcript.length() <= maxTranscriptChars) {
      return transcript;
    }
    return transcript.substring(0, maxTranscriptChars) + TRUNCATION_MARKER;
  }
}
