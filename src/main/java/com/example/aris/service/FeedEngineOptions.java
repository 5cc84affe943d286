package com.example.aris.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validator;
import lombok.Builder;
import lombok.Getter;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Tuning and collaborators for one {@link FeedEngine}. Unset collaborators are created on demand
 * by the engine.
 */
@Getter
@Builder(toBuilder = true)
public class FeedEngineOptions {

  /** Cache lifetime and periodic refresh interval; floored at {@link FeedCache#MIN_TTL}. */
  @Builder.Default
  private final Duration cacheTtl = FeedCache.DEFAULT_TTL;

  /** Per-source budget for item collection; {@code null} disables it. */
  @Builder.Default
  private final Duration itemTimeout = Duration.ofSeconds(5);

  /** Source of time and timers. */
  @Builder.Default
  private final Scheduler scheduler = Schedulers.parallel();

  private final ObjectMapper objectMapper;
  private final Validator validator;

  public static FeedEngineOptions defaults() {
    return FeedEngineOptions.builder().build();
  }
}
