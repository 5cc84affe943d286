package com.example.aris.processor;

import com.example.aris.model.FeedEnhancement;
import com.example.aris.model.FeedItem;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

/**
 * Pure transform over the collected items of one refresh. Processors run in registration order
 * and each sees the list as left by the ones before it.
 */
public interface FeedPostProcessor {

  String ANONYMOUS = "anonymous";

  /** Name used to attribute errors. Blank names are reported as {@value #ANONYMOUS}. */
  default String name() {
    return ANONYMOUS;
  }

  Mono<FeedEnhancement> process(List<FeedItem> items);

  static FeedPostProcessor of(String name, Function<List<FeedItem>, Mono<FeedEnhancement>> fn) {
    return new FeedPostProcessor() {
      @Override
      public String name() {
        return (name == null || name.isBlank()) ? ANONYMOUS : name;
      }

      @Override
      public Mono<FeedEnhancement> process(List<FeedItem> items) {
        return fn.apply(items);
      }

      @Override
      public String toString() {
        return "FeedPostProcessor[" + name() + "]";
      }
    };
  }
}
