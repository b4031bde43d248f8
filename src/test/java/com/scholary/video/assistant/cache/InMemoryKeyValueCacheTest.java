package com.scholary.video.assistant.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryKeyValueCacheTest {

  private final AtomicLong nanos = new AtomicLong();
  private final Ticker ticker = nanos::get;

  private InMemoryKeyValueCache cache;

  @BeforeEach
  void setUp() {
    cache = new InMemoryKeyValueCache(100, 100, ticker);
  }

  private void advance(Duration duration) {
    nanos.addAndGet(duration.toNanos());
  }

  @Test
  void get_shouldReturnEmptyForUnknownKey() {
    assertThat(cache.get("transcript:missing0001")).isEmpty();
  }

  @Test
  void set_withoutTtl_shouldPersistIndefinitely() {
    cache.set("transcript:abcdefghijk", "hello world");

    advance(Duration.ofDays(365));

    assertThat(cache.get("transcript:abcdefghijk")).contains("hello world");
  }

  @Test
  void set_withTtl_shouldBeUnreadableAfterExpiry() {
    cache.set("quiz:1", "{}", Duration.ofHours(1));

    advance(Duration.ofMinutes(59));
    assertThat(cache.get("quiz:1")).contains("{}");

    advance(Duration.ofMinutes(1));
    assertThat(cache.get("quiz:1")).isEmpty();
  }

  @Test
  void readingAnEntry_shouldNotExtendItsLifetime() {
    cache.set("quiz:1", "{}", Duration.ofMinutes(10));

    for (int i = 0; i < 9; i++) {
      advance(Duration.ofMinutes(1));
      assertThat(cache.get("quiz:1")).isPresent();
    }

    advance(Duration.ofMinutes(1));
    assertThat(cache.get("quiz:1")).isEmpty();
  }

  @Test
  void overwritingWithoutTtl_shouldDropThePreviousExpiry() {
    cache.set("k", "first", Duration.ofSeconds(5));
    cache.set("k", "second");

    advance(Duration.ofMinutes(1));

    assertThat(cache.get("k")).contains("second");
  }

  @Test
  void overwritingWithTtl_shouldExpireTheNewValue() {
    cache.set("k", "first");
    cache.set("k", "second", Duration.ofSeconds(5));

    assertThat(cache.get("k")).contains("second");
    advance(Duration.ofSeconds(5));
    assertThat(cache.get("k")).isEmpty();
  }

  @Test
  void transcriptPressure_shouldNotPushOutQuizzesBeforeTheirTtl() {
    InMemoryKeyValueCache small = new InMemoryKeyValueCache(2, 10, ticker);
    small.set("quiz:1", "{}", Duration.ofHours(1));

    for (int i = 0; i < 500; i++) {
      small.set(String.format("transcript:video%06d", i), "text " + i);
    }
    advance(Duration.ofMinutes(59));

    assertThat(small.get("quiz:1")).contains("{}");
  }

  @Test
  void evict_shouldRemoveEntry() {
    cache.set("transcript:abcdefghijk", "text");

    cache.evict("transcript:abcdefghijk");

    assertThat(cache.get("transcript:abcdefghijk")).isEmpty();
  }

  @Test
  void set_shouldRejectNonPositiveTtl() {
    assertThatThrownBy(() -> cache.set("k", "v", Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> cache.set("k", "v", Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void keys_shouldUseFlatNamespace() {
    assertThat(KeyValueCache.transcriptKey("dQw4w9WgXcQ")).isEqualTo("transcript:dQw4w9WgXcQ");
    assertThat(KeyValueCache.quizKey("42")).isEqualTo("quiz:42");
  }
}
