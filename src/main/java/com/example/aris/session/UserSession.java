package com.example.aris.session;

import com.example.aris.processor.FeedPostProcessor;
import com.example.aris.service.FeedEngine;
import com.example.aris.source.FeedSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** One user's started {@link FeedEngine} and the sources registered with it. */
public class UserSession {

  private final String userId;
  private final FeedEngine engine;
  private final Map<String, FeedSource> sources = new LinkedHashMap<>();

  public UserSession(String userId, FeedEngine engine, List<FeedSource> sources, List<FeedPostProcessor> processors) {
    this.userId = userId;
    this.engine = engine;
    for (FeedSource source : sources) {
      this.sources.put(source.id(), source);
      engine.register(source);
    }
    processors.forEach(engine::registerPostProcessor);
    engine.start();
  }

  public String getUserId() {
    return userId;
  }

  public FeedEngine getEngine() {
    return engine;
  }

  public <T extends FeedSource> Optional<T> getSource(String sourceId, Class<T> type) {
    FeedSource source = sources.get(sourceId);
    return type.isInstance(source) ? Optional.of(type.cast(source)) : Optional.empty();
  }

  public void destroy() {
    engine.stop();
    sources.clear();
  }
}
