package com.scholary.video.assistant.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.video.assistant.generation.GenerationBackend;
import com.scholary.video.assistant.generation.GenerationException;
import com.scholary.video.assistant.transcript.TranscriptProvider;
import com.scholary.video.assistant.transcript.TranscriptSegment;
import com.scholary.video.assistant.transcript.TranscriptUnavailableException;
import com.scholary.video.assistant.transcript.VideoId;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Answers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * End-to-end test of the HTTP API.
 *
 * <p>The transcript provider and the generation backend are mocked; everything in between (cache,
 * orchestrator, stages, quiz store, error mapping and JSON naming) is the real application.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class VideoAssistantIntegrationTest {

  private static final String VIDEO_ID = "dQw4w9WgXcQ";
  private static final String NO_CAPTIONS_ID = "noCaptions1";

  private static final String QUIZ_COMPLETION =
      """
      [{"question":"Which gas do plants absorb?",
        "options":["Carbon dioxide","Oxygen","Helium","Neon"],"answer":"Carbon dioxide"},
       {"question":"What do plants produce?",
        "options":["Salt","Sugar","Iron","Sand"],"answer":"Sugar"},
       {"question":"Which pigment captures light?",
        "options":["Melanin","Keratin","Chlorophyll","Hemoglobin"],"answer":"Chlorophyll"}]
      """;

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Autowired private TestRestTemplate restTemplate;

  @MockBean private TranscriptProvider transcriptProvider;

  @MockBean(answer = Answers.CALLS_REAL_METHODS)
  private GenerationBackend generationBackend;

  @BeforeEach
  void setUp() {
    when(transcriptProvider.fetch(any()))
        .thenReturn(
            List.of(
                new TranscriptSegment("Plants absorb carbon dioxide", 0.0, 2.0),
                new TranscriptSegment("and use chlorophyll to make sugar.", 2.0, 3.0)));
    when(transcriptProvider.fetch(VideoId.of(NO_CAPTIONS_ID)))
        .thenThrow(
            new TranscriptUnavailableException(
                VideoId.of(NO_CAPTIONS_ID), TranscriptUnavailableException.Reason.DISABLED));
    doReturn("A summary of photosynthesis.")
        .when(generationBackend)
        .complete(contains("Summarize"));
    doReturn(QUIZ_COMPLETION).when(generationBackend).complete(contains("quiz questions"));
  }

  private ResponseEntity<String> post(String path, String json) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    return restTemplate.postForEntity(path, new HttpEntity<>(json, headers), String.class);
  }

  private JsonNode body(ResponseEntity<String> response) throws Exception {
    return objectMapper.readTree(response.getBody());
  }

  @Test
  void root_shouldReportRunning() {
    ResponseEntity<String> response = restTemplate.getForEntity("/", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).contains("running");
  }

  @Test
  void transcript_shouldResolveIdFromUrl() throws Exception {
    ResponseEntity<String> response =
        post("/transcript", "{\"video_url\":\"https://youtu.be/" + VIDEO_ID + "\"}");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    JsonNode body = body(response);
    assertThat(body.get("video_id").asText()).isEqualTo(VIDEO_ID);
    assertThat(body.get("transcript").asText())
        .isEqualTo("Plants absorb carbon dioxide and use chlorophyll to make sugar.");
  }

  @Test
  void summary_shouldReturnGeneratedText() throws Exception {
    ResponseEntity<String> response =
        post("/generate-summary", "{\"video_id\":\"" + VIDEO_ID + "\"}");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(body(response).get("summary").asText()).isEqualTo("A summary of photosynthesis.");
  }

  @Test
  void quizRoundTrip_shouldHideAnswersAndVerify() throws Exception {
    ResponseEntity<String> generated =
        post(
            "/generate-quiz",
            "{\"video_id\":\"" + VIDEO_ID + "\",\"difficulty\":\"easy\",\"num_questions\":3}");

    assertThat(generated.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(generated.getBody()).doesNotContain("correct_option").doesNotContain("answer");
    JsonNode quiz = body(generated);
    assertThat(quiz.get("questions")).hasSize(3);
    String quizId = quiz.get("quiz_id").asText();

    ResponseEntity<String> verified =
        post("/verify-answers", "{\"quiz_id\":\"" + quizId + "\",\"user_answers\":[0,1,3]}");

    assertThat(verified.getStatusCode()).isEqualTo(HttpStatus.OK);
    JsonNode result = body(verified);
    assertThat(result.get("results").toString()).isEqualTo("[true,true,false]");
    assertThat(result.get("correct").asInt()).isEqualTo(2);
    assertThat(result.get("total").asInt()).isEqualTo(3);
  }

  @Test
  void unknownQuiz_shouldBeNotFound() throws Exception {
    ResponseEntity<String> response =
        post("/verify-answers", "{\"quiz_id\":\"does-not-exist\",\"user_answers\":[0]}");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(body(response).get("error_code").asText()).isEqualTo("QUIZ_NOT_FOUND");
  }

  @Test
  void videoWithoutCaptions_shouldBeNotAvailable() throws Exception {
    ResponseEntity<String> response =
        post("/generate-summary", "{\"video_id\":\"" + NO_CAPTIONS_ID + "\"}");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(body(response).get("error_code").asText()).isEqualTo("TRANSCRIPT_NOT_AVAILABLE");
  }

  @Test
  void missingVideo_shouldBeInvalidInput() throws Exception {
    ResponseEntity<String> response = post("/generate-topics", "{}");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(body(response).get("error_code").asText()).isEqualTo("INVALID_INPUT");
  }

  @Test
  void unknownDifficulty_shouldBeInvalidInput() throws Exception {
    ResponseEntity<String> response =
        post("/generate-quiz", "{\"video_id\":\"" + VIDEO_ID + "\",\"difficulty\":\"extreme\"}");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(body(response).get("error_code").asText()).isEqualTo("INVALID_INPUT");
  }

  @Test
  void blankQuestion_shouldBeInvalidInput() {
    ResponseEntity<String> response =
        post("/chat", "{\"video_id\":\"" + VIDEO_ID + "\",\"question\":\" \"}");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  void generationFailure_shouldBeDependencyFailure() throws Exception {
    doThrow(new GenerationException("backend returned status 500"))
        .when(generationBackend)
        .complete(contains("main topics"));

    ResponseEntity<String> response =
        post("/generate-topics", "{\"video_id\":\"" + VIDEO_ID + "\"}");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    assertThat(body(response).get("error_code").asText()).isEqualTo("DEPENDENCY_FAILURE");
  }
}
