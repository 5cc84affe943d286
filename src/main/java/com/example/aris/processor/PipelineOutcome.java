package com.example.aris.processor;

import com.example.aris.model.FeedItem;
import com.example.aris.model.ItemGroup;
import com.example.aris.model.SourceError;

import java.util.List;
import java.util.Optional;

/** Final items, surviving groups (absent when none) and all errors after one pipeline pass. */
public record PipelineOutcome(List<FeedItem> items, Optional<List<ItemGroup>> groupedItems, List<SourceError> errors) {

  public PipelineOutcome {
    items = List.copyOf(items);
    errors = List.copyOf(errors);
  }
}
