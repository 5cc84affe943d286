package com.example.aris.service;

import com.example.aris.model.FeedResult;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Holds the last delivered {@link FeedResult} for a fixed TTL. Time is read from the engine's
 * scheduler so the cache and the refresh timer agree on "now".
 */
public class FeedCache {

  public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
  /** Floor applied to configured TTLs so zero or negative values cannot spin the refresh timer. */
  public static final Duration MIN_TTL = Duration.ofMillis(10);

  private final Duration ttl;
  private final Scheduler clock;
  private volatile CacheEntry entry;

  public FeedCache(Duration ttl, Scheduler clock) {
    this.ttl = effectiveTtl(ttl);
    this.clock = clock;
  }

  public static Duration effectiveTtl(Duration requested) {
    if (requested == null) {
      return DEFAULT_TTL;
    }
    return requested.compareTo(MIN_TTL) < 0 ? MIN_TTL : requested;
  }

  public Duration ttl() {
    return ttl;
  }

  public void store(FeedResult result) {
    entry = new CacheEntry(result, Instant.ofEpochMilli(clock.now(TimeUnit.MILLISECONDS)));
  }

  /** The cached result while {@code now - cachedAt <= ttl}, otherwise empty. */
  public Optional<FeedResult> lastFeed() {
    CacheEntry current = entry;
    if (current == null) {
      return Optional.empty();
    }
    long age = clock.now(TimeUnit.MILLISECONDS) - current.cachedAt().toEpochMilli();
    if (age > ttl.toMillis()) {
      return Optional.empty();
    }
    return Optional.of(current.result());
  }

  public Optional<CacheEntry> entry() {
    return Optional.ofNullable(entry);
  }

  public void clear() {
    entry = null;
  }

  public record CacheEntry(FeedResult result, Instant cachedAt) {}
}
