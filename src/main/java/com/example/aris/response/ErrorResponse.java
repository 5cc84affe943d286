package com.example.aris.response;

import java.util.List;

public record ErrorResponse(List<String> errors) {

  public static ErrorResponse of(String... errors) {
    return new ErrorResponse(List.of(errors));
  }
}
