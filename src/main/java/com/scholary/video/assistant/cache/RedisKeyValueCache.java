package com.scholary.video.assistant.cache;

import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis implementation of KeyValueCache.
 *
 * <p>Expiry is enforced by Redis itself ({@code SET key value PX ttl}). Connection and command
 * failures surface as {@link CacheUnavailableException} so that an outage is never mistaken for a
 * cache miss.
 */
public class RedisKeyValueCache implements KeyValueCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(RedisKeyValueCache.class);

  private final StringRedisTemplate redisTemplate;

  public RedisKeyValueCache(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
    LOGGER.info("Initialized Redis cache");
  }

  @Override
  public Optional<String> get(String key) {
    try {
      String value = redisTemplate.opsForValue().get(key);
      LOGGER.debug("Cache {}: key={}", value != null ? "hit" : "miss", key);
      return Optional.ofNullable(value);
    } catch (DataAccessException e) {
      throw new CacheUnavailableException("Failed to read cache key: " + key, e);
    }
  }

  @Override
  public void set(String key, String value) {
    try {
      redisTemplate.opsForValue().set(key, value);
      LOGGER.debug("Cached entry: key={}, ttl=none", key);
    } catch (DataAccessException e) {
      throw new CacheUnavailableException("Failed to write cache key: " + key, e);
    }
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive: " + ttl);
    }
    try {
      redisTemplate.opsForValue().set(key, value, ttl);
      LOGGER.debug("Cached entry: key={}, ttl={}", key, ttl);
    } catch (DataAccessException e) {
      throw new CacheUnavailableException("Failed to write cache key: " + key, e);
    }
  }

  @Override
  public void evict(String key) {
    try {
      redisTemplate.delete(key);
      LOGGER.debug("Evicted entry: key={}", key);
    } catch (DataAccessException e) {
      throw new CacheUnavailableException("Failed to evict cache key: " + key, e);
    }
  }
}
