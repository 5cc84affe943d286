package com.example.aris.graph;

import com.example.aris.source.FeedSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link SourceGraph} from sources in registration order.
 *
 * <p>Validation happens up front: every declared dependency must resolve, and the graph must be
 * acyclic. The sort is a depth-first post-order over sources in registration order, so when
 * several orders are valid the earlier-registered source wins.
 */
public final class SourceGraphBuilder {

  private enum Mark { IN_PROGRESS, DONE }

  private SourceGraphBuilder() {}

  public static SourceGraph build(Collection<? extends FeedSource> sources) {
    Map<String, FeedSource> byId = new LinkedHashMap<>();
    for (FeedSource source : sources) {
      byId.put(source.id(), source);
    }

    for (FeedSource source : byId.values()) {
      for (String dependency : dependenciesOf(source)) {
        if (!byId.containsKey(dependency)) {
          throw new MissingDependencyException(source.id(), dependency);
        }
      }
    }

    Map<String, Mark> marks = new HashMap<>();
    List<FeedSource> sorted = new ArrayList<>(byId.size());
    for (FeedSource source : byId.values()) {
      visit(source.id(), byId, marks, new ArrayList<>(), sorted);
    }

    Map<String, List<String>> dependents = new LinkedHashMap<>();
    for (FeedSource source : byId.values()) {
      for (String dependency : dependenciesOf(source)) {
        dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(source.id());
      }
    }
    dependents.replaceAll((k, v) -> List.copyOf(v));

    return new SourceGraph(byId, sorted, dependents);
  }

  private static void visit(String id, Map<String, FeedSource> byId, Map<String, Mark> marks,
                            List<String> path, List<FeedSource> sorted) {
    Mark mark = marks.get(id);
    if (mark == Mark.DONE) {
      return;
    }
    if (mark == Mark.IN_PROGRESS) {
      List<String> cycle = new ArrayList<>(path.subList(path.indexOf(id), path.size()));
      cycle.add(id);
      throw new DependencyCycleException(cycle);
    }

    marks.put(id, Mark.IN_PROGRESS);
    path.add(id);
    FeedSource source = byId.get(id);
    for (String dependency : dependenciesOf(source)) {
      visit(dependency, byId, marks, path, sorted);
    }
    path.remove(path.size() - 1);
    marks.put(id, Mark.DONE);
    sorted.add(source);
  }

  private static List<String> dependenciesOf(FeedSource source) {
    List<String> dependencies = source.dependencies();
    return dependencies == null ? List.of() : dependencies;
  }
}
