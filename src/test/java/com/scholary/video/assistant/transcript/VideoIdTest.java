package com.scholary.video.assistant.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.video.assistant.error.ErrorKind;
import com.scholary.video.assistant.error.InvalidInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class VideoIdTest {

  @ParameterizedTest
  @ValueSource(
      strings = {
        "https://www.youtube.com/watch?v=dQw4w9WgXcQ",
        "https://www.youtube.com/watch?feature=share&v=dQw4w9WgXcQ&t=42",
        "https://youtu.be/dQw4w9WgXcQ",
        "https://youtu.be/dQw4w9WgXcQ?si=abc",
        "https://www.youtube.com/shorts/dQw4w9WgXcQ",
        "https://www.youtube.com/embed/dQw4w9WgXcQ"
      })
  void fromUrl_shouldExtractIdFromSupportedForms(String url) {
    assertThat(VideoId.fromUrl(url).value()).isEqualTo("dQw4w9WgXcQ");
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "https://www.youtube.com/",
        "https://example.com/watch?x=dQw4w9WgXcQ",
        "https://youtu.be/short",
        "https://www.youtube.com/watch?v=dQw4w9WgXcQextra"
      })
  void fromUrl_shouldRejectUrlsWithoutId(String url) {
    assertThatThrownBy(() -> VideoId.fromUrl(url))
        .isInstanceOf(InvalidInputException.class)
        .satisfies(
            e -> assertThat(((InvalidInputException) e).kind()).isEqualTo(ErrorKind.INVALID_INPUT));
  }

  @Test
  void of_shouldRejectMalformedIds() {
    assertThatThrownBy(() -> VideoId.of("too-short")).isInstanceOf(InvalidInputException.class);
    assertThatThrownBy(() -> VideoId.of("has space!!")).isInstanceOf(InvalidInputException.class);
    assertThatThrownBy(() -> VideoId.of(null)).isInstanceOf(InvalidInputException.class);
  }

  @Test
  void resolve_shouldPreferExplicitId() {
    VideoId id = VideoId.resolve("abcdefghijk", "https://youtu.be/dQw4w9WgXcQ");

    assertThat(id.value()).isEqualTo("abcdefghijk");
  }

  @Test
  void resolve_shouldFallBackToUrl() {
    assertThat(VideoId.resolve(null, "https://youtu.be/dQw4w9WgXcQ").value())
        .isEqualTo("dQw4w9WgXcQ");
    assertThat(VideoId.resolve("  ", "https://youtu.be/dQw4w9WgXcQ").value())
        .isEqualTo("dQw4w9WgXcQ");
  }

  @Test
  void resolve_shouldRejectWhenNothingGiven() {
    assertThatThrownBy(() -> VideoId.resolve(null, null))
        .isInstanceOf(InvalidInputException.class)
        .hasMessageContaining("video_id or video_url");
  }
}
