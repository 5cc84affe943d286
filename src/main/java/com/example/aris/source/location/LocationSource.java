package com.example.aris.source.location;

import com.example.aris.action.ActionDefinition;
import com.example.aris.action.UnknownActionException;
import com.example.aris.model.Context;
import com.example.aris.model.ContextKey;
import com.example.aris.source.Capability;
import com.example.aris.source.FeedSource;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Context-only source for the user's location. It never queries a device itself; positions are
 * pushed in through {@link #pushLocation} or the {@code update-location} action, and each push is
 * forwarded to context listeners.
 */
@Slf4j
public class LocationSource implements FeedSource {

  public static final String ID = "aris.location";
  public static final String UPDATE_LOCATION = "update-location";
  public static final ContextKey<Location> LOCATION = ContextKey.of("location", Location.class);

  private static final Map<String, ActionDefinition> ACTIONS = Map.of(
      UPDATE_LOCATION,
      ActionDefinition.of(UPDATE_LOCATION, "Replace the user's current location", Location.class));

  private final int historySize;
  private final Deque<Location> history = new ArrayDeque<>();
  private final List<Consumer<Map<String, Object>>> listeners = new CopyOnWriteArrayList<>();

  public LocationSource() {
    this(1);
  }

  public LocationSource(int historySize) {
    if (historySize < 1) {
      throw new IllegalArgumentException("historySize must be >= 1");
    }
    this.historySize = historySize;
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public Set<Capability> capabilities() {
    return EnumSet.of(Capability.CONTEXT, Capability.CONTEXT_UPDATES, Capability.ACTIONS);
  }

  /** Records a location and notifies every context listener. */
  public void pushLocation(Location location) {
    synchronized (history) {
      history.addLast(location);
      while (history.size() > historySize) {
        history.removeFirst();
      }
    }
    Map<String, Object> update = LOCATION.entry(location);
    for (Consumer<Map<String, Object>> listener : listeners) {
      listener.accept(update);
    }
  }

  public Optional<Location> lastLocation() {
    synchronized (history) {
      return Optional.ofNullable(history.peekLast());
    }
  }

  /** Oldest first, at most {@code historySize} entries. */
  public List<Location> locationHistory() {
    synchronized (history) {
      return List.copyOf(history);
    }
  }

  @Override
  public Mono<Map<String, Object>> fetchContext(Context context) {
    return Mono.justOrEmpty(lastLocation()).map(LOCATION::entry);
  }

  @Override
  public Disposable onContextUpdate(Consumer<Map<String, Object>> callback, Supplier<Context> context) {
    listeners.add(callback);
    return () -> listeners.remove(callback);
  }

  @Override
  public Mono<Map<String, ActionDefinition>> listActions() {
    return Mono.just(ACTIONS);
  }

  @Override
  public Mono<Object> executeAction(String actionId, Object input) {
    if (!UPDATE_LOCATION.equals(actionId)) {
      return Mono.error(new UnknownActionException(ID, actionId));
    }
    if (!(input instanceof Location location)) {
      return Mono.error(new IllegalArgumentException("update-location expects a Location"));
    }
    return Mono.fromRunnable(() -> {
      log.debug("Location updated: accuracy={}m", location.accuracy());
      pushLocation(location);
    });
  }
}
