package com.example.aris.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.List;

/**
 * Directives returned by a post-processor: items to inject, item ids to suppress, and groups to
 * present together. Any field may be left empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class FeedEnhancement {

  @Builder.Default
  private List<FeedItem> additionalItems = new ArrayList<>();

  @Builder.Default
  private List<String> suppress = new ArrayList<>();

  @Builder.Default
  private List<ItemGroup> groupedItems = new ArrayList<>();

  public static FeedEnhancement none() {
    return new FeedEnhancement();
  }
}
