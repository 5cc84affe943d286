package com.example.aris.service;

import com.example.aris.model.Context;
import com.example.aris.model.FeedItem;
import com.example.aris.model.SourceError;
import com.example.aris.source.Capability;
import com.example.aris.source.FeedSource;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Fans {@code fetchItems} out to every item-producing source at once and gathers the results.
 *
 * <p>Each source is raced against {@code timeout}; a slow or failing source becomes a
 * {@link SourceError} for that source alone. Output order follows the order of the given sources,
 * then each source's own order, whatever order the calls complete in.
 */
@Slf4j
public class ItemCollector {

  private final Duration timeout;
  private final Scheduler scheduler;

  /** @param timeout per-source budget, or {@code null} for no bound */
  public ItemCollector(Duration timeout, Scheduler scheduler) {
    this.timeout = timeout;
    this.scheduler = scheduler;
  }

  public Mono<Batch> collect(List<FeedSource> sources, Context context) {
    List<Mono<Slot>> calls = new ArrayList<>();
    for (FeedSource source : sources) {
      if (source.supports(Capability.ITEMS)) {
        calls.add(fetch(source, context));
      }
    }
    if (calls.isEmpty()) {
      return Mono.just(new Batch(List.of(), List.of()));
    }
    return Flux.mergeSequential(calls)
        .collectList()
        .map(ItemCollector::flatten);
  }

  private Mono<Slot> fetch(FeedSource source, Context context) {
    Mono<List<FeedItem>> call = Mono.defer(() -> source.fetchItems(context))
        .defaultIfEmpty(List.of())
        .map(items -> requireNoNulls(source, items));
    if (timeout != null) {
      call = call.timeout(timeout, scheduler)
          .onErrorMap(TimeoutException.class, ex -> new ItemTimeoutException(source.id(), timeout));
    }
    return call
        .map(items -> new Slot(items, null))
        .onErrorResume(ex -> {
          log.warn("Source {} failed to produce items: {}", source.id(), ex.toString());
          return Mono.just(new Slot(List.of(), new SourceError(source.id(), ex)));
        });
  }

  private static List<FeedItem> requireNoNulls(FeedSource source, List<FeedItem> items) {
    for (int i = 0; i < items.size(); i++) {
      if (items.get(i) == null) {
        throw new IllegalStateException("Source \"" + source.id() + "\" returned a null item at index " + i);
      }
    }
    return items;
  }

  private static Batch flatten(List<Slot> slots) {
    List<FeedItem> items = new ArrayList<>();
    List<SourceError> errors = new ArrayList<>();
    for (Slot slot : slots) {
      if (slot.items() != null) {
        items.addAll(slot.items());
      }
      if (slot.error() != null) {
        errors.add(slot.error());
      }
    }
    return new Batch(items, errors);
  }

  private record Slot(List<FeedItem> items, SourceError error) {}

  /** Items and per-source errors from one collection pass. */
  public record Batch(List<FeedItem> items, List<SourceError> errors) {}
}
