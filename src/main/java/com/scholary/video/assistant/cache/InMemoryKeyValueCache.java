package com.scholary.video.assistant.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process implementation of KeyValueCache using Caffeine.
 *
 * <p>Entries written without a time to live and entries written with one live in two separate
 * regions, each with its own size bound. Transcripts pushed out under size pressure are simply
 * fetched again; they never push out a quiz before its time to live has elapsed.
 */
public class InMemoryKeyValueCache implements KeyValueCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryKeyValueCache.class);

  private final Cache<String, String> persistent;
  private final Cache<String, Entry> expiring;

  public InMemoryKeyValueCache(long maxSize, long expiringMaxSize) {
    this(maxSize, expiringMaxSize, Ticker.systemTicker());
  }

  InMemoryKeyValueCache(long maxSize, long expiringMaxSize, Ticker ticker) {
    this.persistent = Caffeine.newBuilder().maximumSize(maxSize).build();
    this.expiring =
        Caffeine.newBuilder()
            .maximumSize(expiringMaxSize)
            .expireAfter(new PerEntryExpiry())
            .ticker(ticker)
            .build();

    LOGGER.info(
        "Initialized in-memory cache: maxSize={}, expiringMaxSize={}", maxSize, expiringMaxSize);
  }

  @Override
  public Optional<String> get(String key) {
    Entry entry = expiring.getIfPresent(key);
    String value = entry != null ? entry.value() : persistent.getIfPresent(key);
    if (value != null) {
      LOGGER.debug("Cache hit: key={}", key);
      return Optional.of(value);
    } else {
      LOGGER.debug("Cache miss: key={}", key);
      return Optional.empty();
    }
  }

  @Override
  public void set(String key, String value) {
    Objects.requireNonNull(value, "value");
    expiring.invalidate(key);
    persistent.put(key, value);
    LOGGER.debug("Cached entry: key={}, ttl=none", key);
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive: " + ttl);
    }
    Objects.requireNonNull(value, "value");
    persistent.invalidate(key);
    expiring.put(key, new Entry(value, ttl));
    LOGGER.debug("Cached entry: key={}, ttl={}", key, ttl);
  }

  @Override
  public void evict(String key) {
    persistent.invalidate(key);
    expiring.invalidate(key);
    LOGGER.debug("Evicted entry: key={}", key);
  }

  private record Entry(String value, Duration ttl) {}

  // Fixed lifetime from the last write; reads never extend it.
  private static final class PerEntryExpiry implements Expiry<String, Entry> {

    @Override
    public long expireAfterCreate(String key, Entry entry, long currentTime) {
      return entry.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(
        String key, Entry entry, long currentTime, long currentDuration) {
      return entry.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
