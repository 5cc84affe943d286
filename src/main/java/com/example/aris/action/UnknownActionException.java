package com.example.aris.action;

/** Raised when an action id is not among the actions a source declares. */
public class UnknownActionException extends RuntimeException {

  private final String sourceId;
  private final String actionId;

  public UnknownActionException(String sourceId, String actionId) {
    super("Action \"" + actionId + "\" not found on source \"" + sourceId + "\"");
    this.sourceId = sourceId;
    this.actionId = actionId;
  }

  public String getSourceId() {
    return sourceId;
  }

  public String getActionId() {
    return actionId;
  }
}
