package com.example.aris.service;

import static com.example.aris.source.StubSource.item;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.aris.graph.DependencyCycleException;
import com.example.aris.graph.MissingDependencyException;
import com.example.aris.model.FeedEnhancement;
import com.example.aris.model.FeedItem;
import com.example.aris.model.FeedResult;
import com.example.aris.model.SourceError;
import com.example.aris.processor.FeedPostProcessor;
import com.example.aris.source.StubSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

class FeedEngineTest {

  private VirtualTimeScheduler scheduler;
  private FeedEngine engine;
  private final List<FeedResult> delivered = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() {
    scheduler = VirtualTimeScheduler.create();
    engine = new FeedEngine(FeedEngineOptions.builder()
        .cacheTtl(Duration.ofMinutes(1))
        .itemTimeout(Duration.ofSeconds(2))
        .scheduler(scheduler)
        .build());
  }

  @AfterEach
  void tearDown() {
    engine.stop();
    scheduler.dispose();
  }

  private static List<String> ids(FeedResult result) {
    return result.items().stream().map(FeedItem::getId).toList();
  }

  private static StubSource location() {
    return StubSource.builder("location")
        .contextValue("location", ctx -> "home")
        .pushesContext()
        .build();
  }

  private static StubSource weather() {
    return StubSource.builder("weather")
        .dependsOn("location")
        .contextValue("weather", ctx -> "rain at " + ctx.get("location").orElse("?"))
        .build();
  }

  private static StubSource alert() {
    return StubSource.builder("alert")
        .dependsOn("weather")
        .items(ctx -> Mono.just(List.of(FeedItem.builder()
            .id("alert-1")
            .type("alert")
            .data(Map.of("weather", ctx.get("weather").orElse("none")))
            .build())))
        .build();
  }

  // ---------------------------------------------------------------- refresh

  @Test
  void contextAccumulatesInDependencyOrder() {
    StubSource location = location();
    StubSource weather = weather();
    engine.register(alert()).register(weather).register(location);

    FeedResult result = engine.refresh().block();

    assertThat(weather.seenContexts()).singleElement()
        .satisfies(ctx -> assertThat(ctx.get("location")).contains("home"));
    assertThat(result.context().entries())
        .containsEntry("location", "home")
        .containsEntry("weather", "rain at home");
    assertThat(result.items()).singleElement()
        .satisfies(item -> assertThat(item.getData()).containsEntry("weather", "rain at home"));
    assertThat(engine.currentContext()).isEqualTo(result.context());
  }

  @Test
  void failingSourceIsIsolated() {
    engine.register(StubSource.builder("ok").items(item("a", "t")).build())
        .register(StubSource.builder("broken")
            .items(ctx -> Mono.error(new IllegalStateException("upstream 503")))
            .build())
        .register(StubSource.builder("also-ok").items(item("b", "t")).build());

    FeedResult result = engine.refresh().block();

    assertThat(ids(result)).containsExactly("a", "b");
    assertThat(result.errors()).singleElement().satisfies(error -> {
      assertThat(error.sourceId()).isEqualTo("broken");
      assertThat(error.message()).isEqualTo("upstream 503");
    });
  }

  @Test
  void sourceReturningNullItemDoesNotFailTheRefresh() {
    engine.register(StubSource.builder("ok").items(item("a", "t")).build())
        .register(StubSource.builder("sloppy")
            .items(ctx -> Mono.just(Arrays.asList(item("b", "t"), null)))
            .build());

    FeedResult result = engine.refresh().block();

    assertThat(ids(result)).containsExactly("a");
    assertThat(result.errors()).extracting(SourceError::sourceId).containsExactly("sloppy");
    assertThat(engine.lastFeed()).containsSame(result);
  }

  @Test
  void failedContextIsSkippedAndDependentsStillRun() {
    StubSource weather = weather();
    engine.register(StubSource.builder("location")
            .context(ctx -> Mono.error(new RuntimeException("no fix")))
            .build())
        .register(weather);

    FeedResult result = engine.refresh().block();

    assertThat(result.errors()).extracting(SourceError::sourceId).containsExactly("location");
    assertThat(result.context().entries()).containsEntry("weather", "rain at ?");
  }

  @Test
  void refreshFailsOnInvalidGraph() {
    engine.register(StubSource.builder("a").dependsOn("b").items().build())
        .register(StubSource.builder("b").dependsOn("a").items().build());

    assertThatThrownBy(() -> engine.refresh().block())
        .isInstanceOf(DependencyCycleException.class)
        .hasMessageContaining("a → b → a");
  }

  @Test
  void registrationChangesInvalidateTheGraph() {
    engine.register(StubSource.builder("a").items().build());
    assertThat(engine.graph().size()).isEqualTo(1);

    engine.register(StubSource.builder("b").dependsOn("missing").items().build());
    assertThatThrownBy(() -> engine.graph()).isInstanceOf(MissingDependencyException.class);

    engine.unregister("b");
    assertThat(engine.graph().size()).isEqualTo(1);
  }

  @Test
  void sameIdRegistrationReplacesPreviousSource() {
    engine.register(StubSource.builder("news").items(item("old", "t")).build())
        .register(StubSource.builder("news").items(item("new", "t")).build());

    FeedResult result = engine.refresh().block();

    assertThat(engine.sourceIds()).containsExactly("news");
    assertThat(ids(result)).containsExactly("new");
  }

  @Test
  void rejectsSourcesWithoutIdOrCapabilities() {
    assertThatThrownBy(() -> engine.register(StubSource.builder(" ").items().build()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> engine.register(StubSource.builder("idle").build()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void postProcessorsShapeTheResult() {
    engine.register(StubSource.builder("weather").items(item("w1", "weather"), item("w2", "weather")).build())
        .registerPostProcessor(FeedPostProcessor.of("dedupe", items -> Mono.just(FeedEnhancement.builder()
            .suppress(List.of("w2"))
            .build())));

    FeedResult result = engine.refresh().block();

    assertThat(ids(result)).containsExactly("w1");
    assertThat(result.groupedItems()).isEmpty();
  }

  // ---------------------------------------------------------------- cache

  @Test
  void lastFeedIsFreshUntilTtlExpires() {
    engine.register(StubSource.builder("news").items(item("a", "t")).build());
    assertThat(engine.lastFeed()).isEmpty();

    FeedResult result = engine.refresh().block();
    assertThat(engine.lastFeed()).containsSame(result);

    scheduler.advanceTimeBy(Duration.ofMinutes(1));
    assertThat(engine.lastFeed()).containsSame(result);

    scheduler.advanceTimeBy(Duration.ofMillis(1));
    assertThat(engine.lastFeed()).isEmpty();
  }

  // ---------------------------------------------------------------- reactive path

  @Test
  void contextPushRecomputesDependentsAndNotifies() {
    StubSource location = location();
    StubSource weather = weather();
    engine.register(location).register(weather).register(alert());
    engine.subscribe(delivered::add);
    engine.refresh().block();
    engine.start();

    location.pushContext(Map.of("location", "paris"));

    assertThat(delivered).singleElement().satisfies(result -> {
      assertThat(result.context().entries()).containsEntry("weather", "rain at paris");
      assertThat(result.items()).singleElement()
          .satisfies(item -> assertThat(item.getData()).containsEntry("weather", "rain at paris"));
    });
    assertThat(location.contextCalls()).isEqualTo(1);
    assertThat(weather.contextCalls()).isEqualTo(2);
    assertThat(engine.lastFeed()).containsSame(delivered.get(0));
  }

  @Test
  void itemsPushRecollectsWithoutRefetchingContext() {
    StubSource location = location();
    StubSource news = StubSource.builder("news").items(item("n1", "news")).pushesItems().build();
    engine.register(location).register(news);
    engine.subscribe(delivered::add);
    engine.refresh().block();
    engine.start();

    news.pushItems();

    assertThat(delivered).singleElement().satisfies(result -> {
      assertThat(ids(result)).containsExactly("n1");
      assertThat(result.context().entries()).containsEntry("location", "home");
    });
    assertThat(location.contextCalls()).isEqualTo(1);
    assertThat(news.itemCalls()).isEqualTo(2);
  }

  @Test
  void dependentContextFailureOnPushIsReported() {
    StubSource location = location();
    engine.register(location)
        .register(StubSource.builder("weather")
            .dependsOn("location")
            .context(ctx -> ctx.get("location").filter("paris"::equals).isPresent()
                ? Mono.error(new IllegalStateException("weather api down"))
                : Mono.empty())
            .build());
    engine.subscribe(delivered::add);
    engine.start();

    location.pushContext(Map.of("location", "paris"));

    assertThat(delivered).singleElement().satisfies(result ->
        assertThat(result.errors()).singleElement().satisfies(error -> {
          assertThat(error.sourceId()).isEqualTo("weather");
          assertThat(error.message()).isEqualTo("weather api down");
        }));
  }

  @Test
  void noNotificationsAfterStop() {
    StubSource location = location();
    engine.register(location).register(alert()).register(weather());
    engine.subscribe(delivered::add);
    engine.start();
    engine.stop();

    location.pushContext(Map.of("location", "paris"));
    scheduler.advanceTimeBy(Duration.ofMinutes(5));

    assertThat(delivered).isEmpty();
  }

  @Test
  void startIsIdempotentAndStopDisposesOnce() {
    StubSource location = location();
    engine.register(location);

    engine.start();
    engine.start();
    assertThat(location.subscribeCalls()).isEqualTo(1);

    engine.stop();
    engine.stop();
    assertThat(location.disposeCalls()).isEqualTo(1);
    assertThat(location.listenerCount()).isZero();

    engine.start();
    assertThat(location.subscribeCalls()).isEqualTo(2);
    assertThat(engine.isStarted()).isTrue();
  }

  @Test
  void registerWhileStartedSubscribesAndUnregisterDisposes() {
    engine.start();
    StubSource location = location();

    engine.register(location);
    assertThat(location.listenerCount()).isEqualTo(1);

    engine.unregister("location");
    assertThat(location.disposeCalls()).isEqualTo(1);

    engine.stop();
    assertThat(location.disposeCalls()).isEqualTo(1);
  }

  @Test
  void throwingSubscriberDoesNotBlockOthers() {
    StubSource location = location();
    engine.register(location);
    engine.subscribe(result -> {
      throw new IllegalStateException("render failed");
    });
    engine.subscribe(delivered::add);
    engine.start();

    location.pushContext(Map.of("location", "office"));

    assertThat(delivered).hasSize(1);
  }

  @Test
  void disposedSubscriberIsNoLongerCalled() {
    StubSource location = location();
    engine.register(location);
    Disposable subscription = engine.subscribe(delivered::add);
    engine.start();

    subscription.dispose();
    location.pushContext(Map.of("location", "office"));

    assertThat(delivered).isEmpty();
  }

  @Test
  void periodicRefreshFiresEveryTtl() {
    StubSource news = StubSource.builder("news").items(item("n1", "news")).build();
    engine.register(news);
    engine.subscribe(delivered::add);
    engine.start();

    scheduler.advanceTimeBy(Duration.ofSeconds(59));
    assertThat(delivered).isEmpty();

    scheduler.advanceTimeBy(Duration.ofSeconds(1));
    assertThat(delivered).hasSize(1);

    scheduler.advanceTimeBy(Duration.ofMinutes(1));
    assertThat(delivered).hasSize(2);
    assertThat(news.itemCalls()).isEqualTo(2);
  }

  @Test
  void pushResetsThePeriodicTimer() {
    StubSource location = location();
    engine.register(location);
    engine.subscribe(delivered::add);
    engine.start();

    scheduler.advanceTimeBy(Duration.ofSeconds(30));
    location.pushContext(Map.of("location", "office"));
    assertThat(delivered).hasSize(1);

    scheduler.advanceTimeBy(Duration.ofSeconds(59));
    assertThat(delivered).hasSize(1);

    scheduler.advanceTimeBy(Duration.ofSeconds(1));
    assertThat(delivered).hasSize(2);
  }

  @Test
  void failedPeriodicRefreshKeepsTheTimerRunning() {
    engine.register(StubSource.builder("news").items(item("n1", "news")).build());
    engine.subscribe(delivered::add);
    engine.start();
    engine.register(StubSource.builder("weather").dependsOn("location").items().build());

    scheduler.advanceTimeBy(Duration.ofMinutes(1));
    assertThat(delivered).isEmpty();

    engine.register(location());
    scheduler.advanceTimeBy(Duration.ofMinutes(1));
    assertThat(delivered).hasSize(1);
  }
}
