package com.example.aris.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Source-provided hints for post-processors. Sources express relevance without deciding the final
 * ranking; the engine passes these through untouched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FeedItemSignals(Double urgency, TimeRelevance timeRelevance) {

  public FeedItemSignals {
    if (urgency != null && (urgency.isNaN() || urgency < 0.0 || urgency > 1.0)) {
      throw new IllegalArgumentException("urgency must be within [0, 1], got " + urgency);
    }
  }

  public static FeedItemSignals of(double urgency, TimeRelevance timeRelevance) {
    return new FeedItemSignals(urgency, timeRelevance);
  }
}
