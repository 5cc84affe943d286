package com.example.aris.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class LocationUpdateRequest {
  private Double lat;
  private Double lng;
  private Double accuracy;
  private Instant timestamp;
}
