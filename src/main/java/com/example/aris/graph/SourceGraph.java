package com.example.aris.graph;

import com.example.aris.source.FeedSource;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated dependency graph over the registered sources.
 *
 * <p>{@code sorted} holds every source once, each after all of its dependencies.
 * {@code dependents} is the reverse index: id to the ids that directly depend on it.
 */
public record SourceGraph(
    Map<String, FeedSource> byId,
    List<FeedSource> sorted,
    Map<String, List<String>> dependents
) {

  public SourceGraph {
    byId = Map.copyOf(byId);
    sorted = List.copyOf(sorted);
    dependents = Map.copyOf(dependents);
  }

  public Optional<FeedSource> find(String id) {
    return Optional.ofNullable(byId.get(id));
  }

  public List<String> directDependentsOf(String id) {
    return dependents.getOrDefault(id, List.of());
  }

  /**
   * Transitive dependents of {@code id}, in topological order. Each id appears once even when
   * reachable over several paths.
   */
  public List<String> dependentsOf(String id) {
    Set<String> seen = new LinkedHashSet<>();
    collect(id, seen);
    List<String> ordered = new ArrayList<>(seen.size());
    for (FeedSource source : sorted) {
      if (seen.contains(source.id())) {
        ordered.add(source.id());
      }
    }
    return ordered;
  }

  private void collect(String id, Set<String> seen) {
    for (String dependent : directDependentsOf(id)) {
      if (seen.add(dependent)) {
        collect(dependent, seen);
      }
    }
  }

  public int size() {
    return sorted.size();
  }
}
