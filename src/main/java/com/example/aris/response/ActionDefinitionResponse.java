package com.example.aris.response;

import com.example.aris.action.ActionDefinition;

public record ActionDefinitionResponse(String id, String description, String inputType) {

  public static ActionDefinitionResponse from(ActionDefinition definition) {
    return new ActionDefinitionResponse(
        definition.id(),
        definition.description(),
        definition.hasInputType() ? definition.inputType().getSimpleName() : null);
  }
}
