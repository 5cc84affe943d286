package com.example.aris.controller;

import com.example.aris.action.ActionInputException;
import com.example.aris.action.SourceNotFoundException;
import com.example.aris.action.UnknownActionException;
import com.example.aris.graph.GraphValidationException;
import com.example.aris.response.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

/** Maps engine exceptions onto HTTP status codes and an {@link ErrorResponse} body. */
@Slf4j
final class ApiErrors {

  private ApiErrors() {}

  static ResponseEntity<?> toResponse(Throwable ex) {
    if (ex instanceof SourceNotFoundException || ex instanceof UnknownActionException) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(ex.getMessage()));
    }
    if (ex instanceof ActionInputException input) {
      return ResponseEntity.badRequest().body(new ErrorResponse(List.copyOf(input.getReasons())));
    }
    if (ex instanceof IllegalArgumentException) {
      return ResponseEntity.badRequest().body(ErrorResponse.of(ex.getMessage()));
    }
    if (ex instanceof GraphValidationException) {
      log.warn("Feed graph is invalid: {}", ex.getMessage());
      return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of(ex.getMessage()));
    }
    log.error("Unexpected failure while serving feed request", ex);
    String detail = ex.getMessage();
    String message = (detail == null || detail.isBlank())
        ? "Unexpected error occurred."
        : "Unexpected error: " + detail;
    return ResponseEntity.internalServerError().body(ErrorResponse.of(message));
  }
}
