package com.example.aris.model;

import java.util.List;
import java.util.Objects;

/** Items a post-processor wants presented together under one summary. */
public record ItemGroup(List<String> itemIds, String summary) {

  public ItemGroup {
    itemIds = List.copyOf(Objects.requireNonNull(itemIds, "itemIds"));
  }
}
