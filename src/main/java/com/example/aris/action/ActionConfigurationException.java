package com.example.aris.action;

/**
 * A source's action map is inconsistent: a key does not match the id of the definition stored
 * under it. Dispatch fails closed instead of guessing which handler was meant.
 */
public class ActionConfigurationException extends RuntimeException {

  public ActionConfigurationException(String sourceId, String key, String definitionId) {
    super("Action ID mismatch on source \"" + sourceId + "\": key \"" + key
        + "\" != definition.id \"" + definitionId + "\"");
  }
}
