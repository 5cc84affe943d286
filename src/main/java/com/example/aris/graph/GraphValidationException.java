package com.example.aris.graph;

/** The registered sources do not form a valid dependency graph. Fatal to the call that built it. */
public class GraphValidationException extends RuntimeException {

  public GraphValidationException(String message) {
    super(message);
  }
}
