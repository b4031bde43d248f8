package com.scholary.video.assistant.config;

import com.scholary.video.assistant.cache.InMemoryKeyValueCache;
import com.scholary.video.assistant.cache.KeyValueCache;
import com.scholary.video.assistant.cache.RedisKeyValueCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Configuration for the key-value cache.
 *
 * <p>{@code assistant.cache.backend=memory} (default) keeps entries in process;
 * {@code assistant.cache.backend=redis} shares them through the Redis configured under {@code
 * spring.data.redis.*}.
 */
@Configuration
public class CacheConfig {

  @Bean
  @ConditionalOnProperty(name = "assistant.cache.backend", havingValue = "redis")
  public KeyValueCache redisKeyValueCache(StringRedisTemplate redisTemplate) {
    return new RedisKeyValueCache(redisTemplate);
  }

  @Bean
  @ConditionalOnProperty(
      name = "assistant.cache.backend",
      havingValue = "memory",
      matchIfMissing = true)
  public KeyValueCache inMemoryKeyValueCache(AssistantProperties properties) {
    return new InMemoryKeyValueCache(
        properties.cache().maxSize(), properties.cache().expiringMaxSize());
  }
}
