package com.example.aris.source;

import com.example.aris.action.ActionDefinition;
import com.example.aris.action.UnknownActionException;
import com.example.aris.model.Context;
import com.example.aris.model.FeedItem;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Unit of registration with the feed engine. A source may provide context for other sources,
 * produce feed items, handle actions, or any combination of these; {@link #capabilities()} says
 * which.
 *
 * <p>Sources form a dependency graph: a source names the ids of the sources whose context it reads
 * and the engine guarantees those run first. Ids follow a reverse-domain convention
 * (e.g. {@code aris.location}) that is not enforced.
 *
 * <p>The default method bodies describe an absent capability. Implementations override the ones
 * they declare.
 */
public interface FeedSource {

  String id();

  default List<String> dependencies() {
    return List.of();
  }

  Set<Capability> capabilities();

  /**
   * Context contribution for one refresh. {@code context} holds only what sources earlier in
   * topological order produced. An empty Mono means "nothing to contribute".
   */
  default Mono<Map<String, Object>> fetchContext(Context context) {
    return Mono.empty();
  }

  /**
   * Subscribes to context pushes. The callback may fire any number of times until the returned
   * handle is disposed.
   */
  default Disposable onContextUpdate(Consumer<Map<String, Object>> callback, Supplier<Context> context) {
    throw new UnsupportedOperationException(id() + " does not push context");
  }

  /** Items for one refresh, computed from the fully accumulated context. */
  default Mono<List<FeedItem>> fetchItems(Context context) {
    return Mono.just(List.of());
  }

  /** Subscribes to item invalidations. Each callback triggers a full item re-collection. */
  default Disposable onItemsUpdate(Runnable callback, Supplier<Context> context) {
    throw new UnsupportedOperationException(id() + " does not push items");
  }

  /** Declared actions keyed by action id. Each key must equal its definition's id. */
  default Mono<Map<String, ActionDefinition>> listActions() {
    return Mono.just(Map.of());
  }

  /**
   * Runs an action. {@code input} is the validated, converted input when the definition declares
   * an input type, otherwise the raw params.
   */
  default Mono<Object> executeAction(String actionId, Object input) {
    return Mono.error(new UnknownActionException(id(), actionId));
  }

  default boolean supports(Capability capability) {
    Set<Capability> declared = capabilities();
    return declared != null && declared.contains(capability);
  }
}
