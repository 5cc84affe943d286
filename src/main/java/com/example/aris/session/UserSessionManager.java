package com.example.aris.session;

import com.example.aris.processor.FeedPostProcessor;
import com.example.aris.service.FeedEngine;
import com.example.aris.service.FeedEngineOptions;
import com.example.aris.source.FeedSource;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/** Keeps one {@link UserSession}, and so one engine, per user id. */
@Slf4j
public class UserSessionManager {

  private final Map<String, UserSession> sessions = new ConcurrentHashMap<>();
  private final List<FeedSourceProvider> providers;
  private final Supplier<List<FeedPostProcessor>> processors;
  private final FeedEngineOptions engineOptions;

  public UserSessionManager(List<FeedSourceProvider> providers,
                            Supplier<List<FeedPostProcessor>> processors,
                            FeedEngineOptions engineOptions) {
    this.providers = List.copyOf(providers);
    this.processors = processors;
    this.engineOptions = engineOptions;
  }

  public UserSession getOrCreate(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId must not be blank");
    }
    return sessions.computeIfAbsent(userId, this::createSession);
  }

  public Optional<UserSession> find(String userId) {
    return Optional.ofNullable(sessions.get(userId));
  }

  public void remove(String userId) {
    UserSession session = sessions.remove(userId);
    if (session != null) {
      session.destroy();
      log.debug("Session closed for user {}", userId);
    }
  }

  public int size() {
    return sessions.size();
  }

  public void shutdown() {
    for (String userId : List.copyOf(sessions.keySet())) {
      remove(userId);
    }
  }

  private UserSession createSession(String userId) {
    List<FeedSource> sources = providers.stream()
        .map(provider -> provider.feedSourceForUser(userId))
        .toList();
    log.debug("Session opened for user {} with {} sources", userId, sources.size());
    return new UserSession(userId, new FeedEngine(engineOptions), sources, processors.get());
  }
}
