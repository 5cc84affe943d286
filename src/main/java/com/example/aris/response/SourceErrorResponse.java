package com.example.aris.response;

import com.example.aris.model.SourceError;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Wire form of a {@link SourceError}: the exception is reduced to its message. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceErrorResponse {
  private String sourceId;
  private String error;

  public static SourceErrorResponse from(SourceError error) {
    return new SourceErrorResponse(error.sourceId(), error.message());
  }
}
