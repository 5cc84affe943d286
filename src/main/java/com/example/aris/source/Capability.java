package com.example.aris.source;

/** Optional capabilities a {@link FeedSource} may declare. The engine only calls what is declared. */
public enum Capability {
  /** On-demand context via {@link FeedSource#fetchContext}. */
  CONTEXT,
  /** Pushed context via {@link FeedSource#onContextUpdate}. */
  CONTEXT_UPDATES,
  /** On-demand items via {@link FeedSource#fetchItems}. */
  ITEMS,
  /** Pushed item invalidation via {@link FeedSource#onItemsUpdate}. */
  ITEM_UPDATES,
  /** Action discovery and execution. */
  ACTIONS
}
