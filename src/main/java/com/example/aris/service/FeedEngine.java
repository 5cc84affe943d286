package com.example.aris.service;

import com.example.aris.action.ActionDefinition;
import com.example.aris.action.ActionDispatcher;
import com.example.aris.graph.SourceGraph;
import com.example.aris.graph.SourceGraphBuilder;
import com.example.aris.model.Context;
import com.example.aris.model.FeedResult;
import com.example.aris.model.SourceError;
import com.example.aris.processor.FeedPostProcessor;
import com.example.aris.processor.PostProcessorPipeline;
import com.example.aris.source.Capability;
import com.example.aris.source.FeedSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Orchestrates {@link FeedSource}s for one user: dependency graph, context flow, item collection,
 * post-processing, caching and periodic refresh.
 *
 * <p>Two paths produce a {@link FeedResult}:
 * <ul>
 *   <li>{@link #refresh()} (pull): context is rebuilt from scratch in topological order, then every
 *       source's items are collected against the final context.</li>
 *   <li>Reactive: after {@link #start()}, a context push re-runs only the pushing source's
 *       transitive dependents, an items push skips straight to item collection. Either way all
 *       items are collected again and subscribers are notified.</li>
 * </ul>
 *
 * <p>Producer failures never fail a refresh; they are returned in {@link FeedResult#errors()}.
 * Graph validation failures do fail it.
 *
 * <p>One instance per user. Pushes and timer ticks are queued and handled one at a time; callers
 * are expected not to overlap their own {@code refresh()} calls.
 *
 * <pre>{@code
 * FeedEngine engine = new FeedEngine()
 *     .register(locationSource)
 *     .register(weatherSource);
 * FeedResult result = engine.refresh().block();
 *
 * engine.subscribe(r -> render(r.items()));
 * engine.start();
 * ...
 * engine.stop();
 * }</pre>
 */
@Slf4j
public class FeedEngine {

  private final Map<String, FeedSource> sources = new LinkedHashMap<>();
  private final List<FeedSubscriber> subscribers = new CopyOnWriteArrayList<>();
  private final Map<String, List<Disposable>> pushSubscriptions = new LinkedHashMap<>();
  private final PostProcessorPipeline pipeline = new PostProcessorPipeline();

  private final Scheduler scheduler;
  private final FeedCache cache;
  private final ItemCollector itemCollector;
  private final ActionDispatcher actions;

  private volatile SourceGraph graph;
  private volatile Context context;
  private volatile boolean started;
  private volatile long epoch;

  private Sinks.Many<Trigger> triggers;
  private Disposable triggerLoop;
  private Disposable refreshTimer;

  public FeedEngine() {
    this(FeedEngineOptions.defaults());
  }

  public FeedEngine(FeedEngineOptions options) {
    this.scheduler = options.getScheduler();
    this.cache = new FeedCache(options.getCacheTtl(), scheduler);
    this.itemCollector = new ItemCollector(options.getItemTimeout(), scheduler);
    ObjectMapper mapper = options.getObjectMapper() != null
        ? options.getObjectMapper()
        : new ObjectMapper().findAndRegisterModules();
    Validator validator = options.getValidator() != null
        ? options.getValidator()
        : Validation.buildDefaultValidatorFactory().getValidator();
    this.actions = new ActionDispatcher(this::findSource, mapper, validator);
    this.context = Context.at(now());
  }

  // ---------------------------------------------------------------- registration

  /** Registers a source, replacing any source with the same id. Invalidates the graph. */
  public synchronized FeedEngine register(FeedSource source) {
    if (source.id() == null || source.id().isBlank()) {
      throw new IllegalArgumentException("source id must not be blank");
    }
    if (source.capabilities() == null || source.capabilities().isEmpty()) {
      throw new IllegalArgumentException("source " + source.id() + " declares no capabilities");
    }
    FeedSource previous = sources.put(source.id(), source);
    graph = null;
    if (started) {
      if (previous != null) {
        disposePushSubscriptions(source.id());
      }
      subscribePush(source, epoch);
    }
    return this;
  }

  /** Removes a source by id. In-flight refreshes still finish with it. */
  public synchronized FeedEngine unregister(String sourceId) {
    if (sources.remove(sourceId) != null) {
      graph = null;
      disposePushSubscriptions(sourceId);
    }
    return this;
  }

  public FeedEngine registerPostProcessor(FeedPostProcessor processor) {
    pipeline.register(processor);
    return this;
  }

  public FeedEngine unregisterPostProcessor(FeedPostProcessor processor) {
    pipeline.unregister(processor);
    return this;
  }

  public synchronized List<String> sourceIds() {
    return List.copyOf(sources.keySet());
  }

  /** Current graph, built on first use after any registration change. */
  public synchronized SourceGraph graph() {
    if (graph == null) {
      graph = SourceGraphBuilder.build(sources.values());
    }
    return graph;
  }

  private synchronized Optional<FeedSource> findSource(String sourceId) {
    return Optional.ofNullable(sources.get(sourceId));
  }

  // ---------------------------------------------------------------- pull path

  /**
   * Rebuilds context and items from every source and caches the result. Subscribers are not
   * notified; the caller holds the result.
   */
  public Mono<FeedResult> refresh() {
    return Mono.defer(() -> {
      SourceGraph current = graph();
      List<SourceError> errors = new CopyOnWriteArrayList<>();

      Mono<Context> accumulated = Mono.just(Context.at(now()));
      for (FeedSource source : current.sorted()) {
        if (source.supports(Capability.CONTEXT)) {
          final FeedSource stage = source;
          accumulated = accumulated.flatMap(ctx -> contribute(stage, ctx, errors));
        }
      }

      return accumulated.flatMap(ctx -> {
        this.context = ctx;
        return collectAndProcess(current, ctx, errors);
      });
    });
  }

  private Mono<Context> contribute(FeedSource source, Context ctx, List<SourceError> errors) {
    return Mono.defer(() -> source.fetchContext(ctx))
        .map(ctx::merge)
        .defaultIfEmpty(ctx)
        .onErrorResume(ex -> {
          log.warn("Source {} failed to produce context: {}", source.id(), ex.toString());
          errors.add(new SourceError(source.id(), ex));
          return Mono.just(ctx);
        });
  }

  private Mono<FeedResult> collectAndProcess(SourceGraph current, Context ctx, List<SourceError> errors) {
    return itemCollector.collect(current.sorted(), ctx)
        .flatMap(batch -> {
          List<SourceError> all = new ArrayList<>(errors);
          all.addAll(batch.errors());
          return pipeline.run(batch.items(), all);
        })
        .map(outcome -> new FeedResult(ctx, outcome.items(), outcome.errors(), outcome.groupedItems()))
        .doOnNext(result -> {
          log.debug("Feed assembled: {} items, {} errors, {} sources",
              result.items().size(), result.errors().size(), current.size());
          updateCache(result);
        });
  }

  // ---------------------------------------------------------------- reactive path

  /**
   * Subscribes to every pushing source and arms the periodic refresh. Repeated calls are no-ops.
   */
  public synchronized void start() {
    if (started) {
      return;
    }
    SourceGraph current = graph();
    started = true;
    long myEpoch = ++epoch;

    triggers = Sinks.many().unicast().onBackpressureBuffer();
    triggerLoop = triggers.asFlux()
        .concatMap(trigger -> handle(trigger, myEpoch))
        .subscribe();

    for (FeedSource source : current.sorted()) {
      subscribePush(source, myEpoch);
    }
    scheduleNextRefresh();
    log.debug("Feed engine started with {} sources", current.size());
  }

  /** Cancels the refresh timer and disposes every push subscription once. */
  public synchronized void stop() {
    if (!started) {
      return;
    }
    started = false;
    epoch++;
    cancelScheduledRefresh();
    for (String sourceId : List.copyOf(pushSubscriptions.keySet())) {
      disposePushSubscriptions(sourceId);
    }
    if (triggerLoop != null) {
      triggerLoop.dispose();
      triggerLoop = null;
    }
    if (triggers != null) {
      triggers.tryEmitComplete();
      triggers = null;
    }
    log.debug("Feed engine stopped");
  }

  public boolean isStarted() {
    return started;
  }

  private void subscribePush(FeedSource source, long subscriptionEpoch) {
    String sourceId = source.id();
    List<Disposable> handles = new ArrayList<>();
    if (source.supports(Capability.CONTEXT_UPDATES)) {
      handles.add(source.onContextUpdate(
          update -> enqueue(Trigger.context(sourceId, update), subscriptionEpoch),
          this::currentContext));
    }
    if (source.supports(Capability.ITEM_UPDATES)) {
      handles.add(source.onItemsUpdate(
          () -> enqueue(Trigger.items(sourceId), subscriptionEpoch),
          this::currentContext));
    }
    if (!handles.isEmpty()) {
      pushSubscriptions.put(sourceId, handles);
    }
  }

  private void disposePushSubscriptions(String sourceId) {
    List<Disposable> handles = pushSubscriptions.remove(sourceId);
    if (handles == null) {
      return;
    }
    for (Disposable handle : handles) {
      try {
        handle.dispose();
      } catch (RuntimeException ex) {
        log.warn("Failed to unsubscribe from source {}: {}", sourceId, ex.toString());
      }
    }
  }

  /**
   * Queues a push or timer tick. When the loop is idle the trigger is handled right here, so the
   * whole recompute (context, items, post-processing, subscribers) runs on the calling thread while
   * it holds the engine lock. For {@code POST /v1/location} that is the request thread; sources
   * that push from latency-sensitive threads should hop to their own scheduler first.
   */
  private synchronized void enqueue(Trigger trigger, long triggerEpoch) {
    if (!started || triggerEpoch != epoch || triggers == null) {
      log.debug("Ignoring stale {} push from {}", trigger.kind(), trigger.sourceId());
      return;
    }
    triggers.emitNext(trigger, Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100)));
  }

  /** Runs one trigger on whichever thread drained the queue; see {@link #enqueue}. */
  private Mono<Void> handle(Trigger trigger, long triggerEpoch) {
    Mono<FeedResult> work = switch (trigger.kind()) {
      case CONTEXT -> recomputeFromContextPush(trigger.sourceId(), trigger.update());
      case ITEMS -> recomputeItems();
      case PERIODIC -> refresh();
    };
    return work
        .doOnNext(result -> {
          if (started && triggerEpoch == epoch) {
            notifySubscribers(result);
          }
        })
        .doOnError(ex -> {
          log.warn("{} refresh failed: {}", trigger.kind(), ex.toString());
          if (trigger.kind() == Trigger.Kind.PERIODIC && started && triggerEpoch == epoch) {
            scheduleNextRefresh();
          }
        })
        .onErrorResume(ex -> Mono.empty())
        .then();
  }

  private Mono<FeedResult> recomputeFromContextPush(String sourceId, Map<String, Object> update) {
    return Mono.defer(() -> {
      SourceGraph current = graph();
      this.context = context.merge(update).withTime(now());
      List<SourceError> errors = new CopyOnWriteArrayList<>();

      Mono<Context> accumulated = Mono.just(this.context);
      for (String dependentId : current.dependentsOf(sourceId)) {
        FeedSource dependent = current.byId().get(dependentId);
        if (dependent != null && dependent.supports(Capability.CONTEXT)) {
          accumulated = accumulated.flatMap(ctx -> contribute(dependent, ctx, errors)
              .doOnNext(next -> this.context = next));
        }
      }
      return accumulated.flatMap(ctx -> collectAndProcess(current, ctx, errors));
    });
  }

  private Mono<FeedResult> recomputeItems() {
    return Mono.defer(() -> collectAndProcess(graph(), context, new ArrayList<>()));
  }

  // ---------------------------------------------------------------- cache and timer

  /** The last result if it is still within the TTL. Empty means "call {@link #refresh()}". */
  public Optional<FeedResult> lastFeed() {
    return cache.lastFeed();
  }

  public Duration cacheTtl() {
    return cache.ttl();
  }

  private void updateCache(FeedResult result) {
    cache.store(result);
    if (started) {
      scheduleNextRefresh();
    }
  }

  private synchronized void scheduleNextRefresh() {
    cancelScheduledRefresh();
    long timerEpoch = epoch;
    refreshTimer = Mono.delay(cache.ttl(), scheduler)
        .subscribe(tick -> enqueue(Trigger.periodic(), timerEpoch));
  }

  private synchronized void cancelScheduledRefresh() {
    if (refreshTimer != null) {
      refreshTimer.dispose();
      refreshTimer = null;
    }
  }

  // ---------------------------------------------------------------- consumers

  /** Adds a subscriber. Disposing the returned handle removes it. */
  public Disposable subscribe(FeedSubscriber subscriber) {
    subscribers.add(subscriber);
    return () -> subscribers.remove(subscriber);
  }

  private void notifySubscribers(FeedResult result) {
    for (FeedSubscriber subscriber : subscribers) {
      try {
        subscriber.onFeed(result);
      } catch (RuntimeException ex) {
        log.warn("Feed subscriber {} failed: {}", subscriber, ex.toString());
      }
    }
  }

  /** Live accumulated context, as last left by a refresh or push. */
  public Context currentContext() {
    return context;
  }

  // ---------------------------------------------------------------- actions

  /**
   * Runs an action on a registered source. Before {@link #start()} this only changes source
   * state; call {@link #refresh()} to see the effect. Once started, sources that push on change
   * drive the reactive path by themselves.
   */
  public Mono<Object> executeAction(String sourceId, String actionId, Object params) {
    return actions.executeAction(sourceId, actionId, params);
  }

  public Mono<Map<String, ActionDefinition>> listActions(String sourceId) {
    return actions.listActions(sourceId);
  }

  private Instant now() {
    return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
  }

  private record Trigger(Kind kind, String sourceId, Map<String, Object> update) {

    enum Kind { CONTEXT, ITEMS, PERIODIC }

    static Trigger context(String sourceId, Map<String, Object> update) {
      return new Trigger(Kind.CONTEXT, sourceId,
          update == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(update)));
    }

    static Trigger items(String sourceId) {
      return new Trigger(Kind.ITEMS, sourceId, Map.of());
    }

    static Trigger periodic() {
      return new Trigger(Kind.PERIODIC, null, Map.of());
    }
  }
}
