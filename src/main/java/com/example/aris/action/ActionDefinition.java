package com.example.aris.action;

import java.util.Objects;

/**
 * Describes an action a source can perform.
 *
 * <p>Action ids use verb-noun kebab-case ({@code update-location}). Together with the source id
 * they form a globally unique name, e.g. {@code aris.location/update-location}. When
 * {@code inputType} is set, raw params are converted to it and bean-validated before the source
 * runs the action.
 */
public record ActionDefinition(String id, String description, Class<?> inputType) {

  public ActionDefinition {
    Objects.requireNonNull(id, "id");
  }

  public static ActionDefinition of(String id, String description) {
    return new ActionDefinition(id, description, null);
  }

  public static ActionDefinition of(String id, String description, Class<?> inputType) {
    return new ActionDefinition(id, description, inputType);
  }

  public boolean hasInputType() {
    return inputType != null;
  }
}
