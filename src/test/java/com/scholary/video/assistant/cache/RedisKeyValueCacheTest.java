package com.scholary.video.assistant.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisKeyValueCacheTest {

  @Mock private StringRedisTemplate redisTemplate;
  @Mock private ValueOperations<String, String> valueOperations;

  private RedisKeyValueCache cache;

  @BeforeEach
  void setUp() {
    cache = new RedisKeyValueCache(redisTemplate);
  }

  @Test
  void get_shouldReturnStoredValue() {
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    when(valueOperations.get("transcript:abcdefghijk")).thenReturn("text");

    assertThat(cache.get("transcript:abcdefghijk")).contains("text");
  }

  @Test
  void get_shouldReturnEmptyOnMiss() {
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);

    assertThat(cache.get("quiz:nope")).isEmpty();
  }

  @Test
  void set_withTtl_shouldDelegateExpiryToRedis() {
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);

    cache.set("quiz:1", "{}", Duration.ofHours(1));

    verify(valueOperations).set("quiz:1", "{}", Duration.ofHours(1));
  }

  @Test
  void set_withoutTtl_shouldWritePlainValue() {
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);

    cache.set("transcript:abcdefghijk", "text");

    verify(valueOperations).set("transcript:abcdefghijk", "text");
  }

  @Test
  void unreachableStore_shouldNotLookLikeAMiss() {
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    when(valueOperations.get(anyString()))
        .thenThrow(new RedisConnectionFailureException("connection refused"));

    assertThatThrownBy(() -> cache.get("transcript:abcdefghijk"))
        .isInstanceOf(CacheUnavailableException.class)
        .hasCauseInstanceOf(RedisConnectionFailureException.class);
  }

  @Test
  void failedWrite_shouldRaiseCacheUnavailable() {
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    doThrow(new RedisConnectionFailureException("down"))
        .when(valueOperations)
        .set("quiz:1", "{}", Duration.ofMinutes(5));

    assertThatThrownBy(() -> cache.set("quiz:1", "{}", Duration.ofMinutes(5)))
        .isInstanceOf(CacheUnavailableException.class);
  }
}
