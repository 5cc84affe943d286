package com.example.aris.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.aris.source.FeedSource;
import com.example.aris.source.StubSource;
import org.junit.jupiter.api.Test;

import java.util.List;

class SourceGraphBuilderTest {

  private static FeedSource source(String id, String... deps) {
    return StubSource.builder(id).dependsOn(deps).items().build();
  }

  private static List<String> ids(SourceGraph graph) {
    return graph.sorted().stream().map(FeedSource::id).toList();
  }

  @Test
  void dependenciesComeBeforeDependents() {
    List<FeedSource> sources = List.of(
        source("alert", "weather", "calendar"),
        source("weather", "location"),
        source("calendar"),
        source("commute", "location", "calendar"),
        source("location"));

    SourceGraph graph = SourceGraphBuilder.build(sources);

    List<String> order = ids(graph);
    assertThat(order).hasSize(sources.size()).doesNotHaveDuplicates();
    for (FeedSource source : sources) {
      for (String dependency : source.dependencies()) {
        assertThat(order.indexOf(dependency))
            .as("%s before %s", dependency, source.id())
            .isLessThan(order.indexOf(source.id()));
      }
    }
  }

  @Test
  void independentSourcesKeepRegistrationOrder() {
    SourceGraph graph = SourceGraphBuilder.build(List.of(
        source("c"), source("a"), source("b", "c")));

    assertThat(ids(graph)).containsExactly("c", "a", "b");
  }

  @Test
  void dependencyRegisteredLaterIsPulledForward() {
    SourceGraph graph = SourceGraphBuilder.build(List.of(
        source("weather", "location"), source("news"), source("location")));

    assertThat(ids(graph)).containsExactly("location", "weather", "news");
  }

  @Test
  void twoCycleNamesFullPath() {
    assertThatThrownBy(() -> SourceGraphBuilder.build(List.of(source("a", "b"), source("b", "a"))))
        .isInstanceOf(DependencyCycleException.class)
        .hasMessageContaining("a → b → a")
        .satisfies(ex -> assertThat(((DependencyCycleException) ex).getCyclePath())
            .containsExactly("a", "b", "a"));
  }

  @Test
  void threeCycleNamesFullPath() {
    assertThatThrownBy(() -> SourceGraphBuilder.build(List.of(
        source("a", "c"), source("b", "a"), source("c", "b"))))
        .isInstanceOf(DependencyCycleException.class)
        .hasMessageContaining("a → c → b → a");
  }

  @Test
  void selfDependencyIsACycle() {
    assertThatThrownBy(() -> SourceGraphBuilder.build(List.of(source("a", "a"))))
        .isInstanceOf(DependencyCycleException.class)
        .hasMessageContaining("a → a");
  }

  @Test
  void missingDependencyNamesBothIds() {
    assertThatThrownBy(() -> SourceGraphBuilder.build(List.of(source("weather", "location"))))
        .isInstanceOf(MissingDependencyException.class)
        .isInstanceOf(GraphValidationException.class)
        .hasMessageContaining("weather")
        .hasMessageContaining("location");
  }

  @Test
  void reverseIndexListsDirectDependents() {
    SourceGraph graph = SourceGraphBuilder.build(List.of(
        source("location"), source("weather", "location"), source("transit", "location"),
        source("alert", "weather")));

    assertThat(graph.directDependentsOf("location")).containsExactly("weather", "transit");
    assertThat(graph.directDependentsOf("weather")).containsExactly("alert");
    assertThat(graph.directDependentsOf("alert")).isEmpty();
  }

  @Test
  void transitiveDependentsAreDedupedAndTopological() {
    // diamond: location -> (weather, transit) -> summary
    SourceGraph graph = SourceGraphBuilder.build(List.of(
        source("summary", "weather", "transit"),
        source("location"),
        source("transit", "location"),
        source("weather", "location")));

    assertThat(graph.dependentsOf("location")).containsExactly("weather", "transit", "summary");
    assertThat(graph.dependentsOf("summary")).isEmpty();
  }

  @Test
  void emptyRegistryBuildsEmptyGraph() {
    SourceGraph graph = SourceGraphBuilder.build(List.of());

    assertThat(graph.sorted()).isEmpty();
    assertThat(graph.dependents()).isEmpty();
  }
}
