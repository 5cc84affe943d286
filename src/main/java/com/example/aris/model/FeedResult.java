package com.example.aris.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one refresh, pull or reactive. This is the unit that gets cached and delivered to
 * subscribers. {@code groupedItems} is absent rather than empty when no group survived.
 */
public record FeedResult(
    Context context,
    List<FeedItem> items,
    List<SourceError> errors,
    Optional<List<ItemGroup>> groupedItems
) {

  public FeedResult {
    Objects.requireNonNull(context, "context");
    items = List.copyOf(items);
    errors = List.copyOf(errors);
    groupedItems = groupedItems == null ? Optional.empty() : groupedItems.map(List::copyOf);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
