package com.example.aris.response;

import com.example.aris.model.FeedItem;
import com.example.aris.model.FeedResult;
import com.example.aris.model.ItemGroup;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeedResponse {
  private Instant contextTime;
  private List<FeedItem> items;
  private List<SourceErrorResponse> errors;
  private List<ItemGroup> groupedItems;

  public static FeedResponse from(FeedResult result) {
    return FeedResponse.builder()
        .contextTime(result.context().getTime())
        .items(result.items())
        .errors(result.errors().stream().map(SourceErrorResponse::from).toList())
        .groupedItems(result.groupedItems().orElse(null))
        .build();
  }
}
