package com.example.aris.action;

import java.util.List;
import java.util.Objects;

/** Action params could not be converted to, or failed validation against, the declared input type. */
public class ActionInputException extends RuntimeException {

  private final List<String> reasons;

  public ActionInputException(String actionId, List<String> reasons) {
    super("Invalid input for action \"" + actionId + "\": " + String.join("; ", reasons));
    this.reasons = List.copyOf(Objects.requireNonNull(reasons, "reasons"));
  }

  public ActionInputException(String actionId, Throwable cause) {
    super("Invalid input for action \"" + actionId + "\": " + cause.getMessage(), cause);
    this.reasons = List.of(String.valueOf(cause.getMessage()));
  }

  public List<String> getReasons() {
    return reasons;
  }
}
