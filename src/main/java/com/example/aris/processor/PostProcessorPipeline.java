package com.example.aris.processor;

import com.example.aris.model.FeedEnhancement;
import com.example.aris.model.FeedItem;
import com.example.aris.model.ItemGroup;
import com.example.aris.model.SourceError;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered chain of {@link FeedPostProcessor}s applied after each refresh.
 *
 * <p>Per processor: additional items are appended, then suppressed ids are filtered out, then
 * groups are collected. A failing processor is recorded under its name and its effect is dropped
 * entirely; the chain carries on with the next one. Groups are sanitised against the final list
 * once every processor has run.
 */
@Slf4j
public class PostProcessorPipeline {

  private final List<FeedPostProcessor> processors = new CopyOnWriteArrayList<>();

  public PostProcessorPipeline register(FeedPostProcessor processor) {
    processors.add(processor);
    return this;
  }

  /** Removes the given instance. Processors are compared by identity. */
  public PostProcessorPipeline unregister(FeedPostProcessor processor) {
    processors.removeIf(p -> p == processor);
    return this;
  }

  public List<FeedPostProcessor> processors() {
    return List.copyOf(processors);
  }

  public Mono<PipelineOutcome> run(List<FeedItem> items, List<SourceError> priorErrors) {
    Mono<PassState> pipeline = Mono.just(new PassState(items, priorErrors));
    for (FeedPostProcessor processor : processors) {
      final FeedPostProcessor stage = processor;
      pipeline = pipeline.flatMap(state -> apply(stage, state));
    }
    return pipeline.map(PassState::toOutcome);
  }

  private Mono<PassState> apply(FeedPostProcessor processor, PassState state) {
    List<FeedItem> snapshot = List.copyOf(state.items);
    return Mono.defer(() -> processor.process(snapshot))
        .defaultIfEmpty(FeedEnhancement.none())
        .map(enhancement -> state.apply(enhancement))
        .onErrorResume(ex -> {
          String name = nameOf(processor);
          log.warn("Post-processor {} failed, discarding its effect: {}", name, ex.toString());
          state.items = new ArrayList<>(snapshot);
          state.errors.add(new SourceError(name, ex));
          return Mono.just(state);
        });
  }

  static String nameOf(FeedPostProcessor processor) {
    String name;
    try {
      name = processor.name();
    } catch (RuntimeException ex) {
      name = null;
    }
    return (name == null || name.isBlank()) ? FeedPostProcessor.ANONYMOUS : name;
  }

  private static final class PassState {
    private List<FeedItem> items;
    private final List<ItemGroup> groups = new ArrayList<>();
    private final List<SourceError> errors;

    private PassState(List<FeedItem> items, List<SourceError> priorErrors) {
      this.items = new ArrayList<>(items);
      this.errors = new ArrayList<>(priorErrors);
    }

    // Builds the next list fully before committing, so a malformed enhancement leaves state untouched.
    private PassState apply(FeedEnhancement enhancement) {
      List<FeedItem> next = new ArrayList<>(items);
      if (enhancement.getAdditionalItems() != null) {
        for (FeedItem added : enhancement.getAdditionalItems()) {
          if (added == null) {
            throw new IllegalStateException("additional items must not contain null");
          }
          next.add(added);
        }
      }
      if (enhancement.getSuppress() != null && !enhancement.getSuppress().isEmpty()) {
        Set<String> suppressed = new HashSet<>(enhancement.getSuppress());
        next.removeIf(item -> suppressed.contains(item.getId()));
      }
      List<ItemGroup> newGroups = enhancement.getGroupedItems() == null
          ? List.of()
          : List.copyOf(enhancement.getGroupedItems());
      items = next;
      groups.addAll(newGroups);
      return this;
    }

    private PipelineOutcome toOutcome() {
      Set<String> present = new HashSet<>();
      for (FeedItem item : items) {
        present.add(item.getId());
      }
      List<ItemGroup> surviving = new ArrayList<>();
      for (ItemGroup group : groups) {
        List<String> ids = group.itemIds().stream().filter(present::contains).toList();
        if (!ids.isEmpty()) {
          surviving.add(new ItemGroup(ids, group.summary()));
        }
      }
      return new PipelineOutcome(
          items,
          surviving.isEmpty() ? Optional.empty() : Optional.of(surviving),
          errors);
    }
  }
}
