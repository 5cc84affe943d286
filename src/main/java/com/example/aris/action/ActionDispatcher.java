package com.example.aris.action;

import com.example.aris.source.Capability;
import com.example.aris.source.FeedSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Routes imperative commands to the source that owns them, outside the refresh cycle.
 *
 * <p>Lookups are checked before anything reaches the source: the source must be registered, its
 * action map must be consistent, the action must be declared, and typed input must convert and
 * validate. Any of these failing leaves the source untouched.
 */
@Slf4j
public class ActionDispatcher {

  private final Function<String, Optional<FeedSource>> lookup;
  private final ObjectMapper objectMapper;
  private final Validator validator;

  public ActionDispatcher(Function<String, Optional<FeedSource>> lookup, ObjectMapper objectMapper, Validator validator) {
    this.lookup = lookup;
    this.objectMapper = objectMapper;
    this.validator = validator;
  }

  public Mono<Map<String, ActionDefinition>> listActions(String sourceId) {
    return Mono.defer(() -> {
      FeedSource source = require(sourceId);
      if (!source.supports(Capability.ACTIONS)) {
        return Mono.just(Map.<String, ActionDefinition>of());
      }
      return source.listActions()
          .defaultIfEmpty(Map.of())
          .map(actions -> checkConsistent(sourceId, actions));
    });
  }

  public Mono<Object> executeAction(String sourceId, String actionId, Object params) {
    return listActions(sourceId).flatMap(actions -> {
      ActionDefinition definition = actions.get(actionId);
      if (definition == null) {
        return Mono.error(new UnknownActionException(sourceId, actionId));
      }
      Object input = toInput(definition, params);
      log.debug("Dispatching {}/{}", sourceId, actionId);
      return require(sourceId).executeAction(actionId, input);
    });
  }

  private FeedSource require(String sourceId) {
    return lookup.apply(sourceId).orElseThrow(() -> new SourceNotFoundException(sourceId));
  }

  private static Map<String, ActionDefinition> checkConsistent(String sourceId, Map<String, ActionDefinition> actions) {
    for (Map.Entry<String, ActionDefinition> entry : actions.entrySet()) {
      String definitionId = entry.getValue() == null ? null : entry.getValue().id();
      if (!entry.getKey().equals(definitionId)) {
        throw new ActionConfigurationException(sourceId, entry.getKey(), definitionId);
      }
    }
    return actions;
  }

  private Object toInput(ActionDefinition definition, Object params) {
    if (!definition.hasInputType()) {
      return params;
    }
    if (params == null) {
      throw new ActionInputException(definition.id(), List.of("input is required"));
    }
    Object input;
    try {
      input = objectMapper.convertValue(params, definition.inputType());
    } catch (IllegalArgumentException ex) {
      throw new ActionInputException(definition.id(), ex);
    }
    Set<ConstraintViolation<Object>> violations = validator.validate(input);
    if (!violations.isEmpty()) {
      List<String> reasons = violations.stream()
          .map(v -> v.getPropertyPath() + " " + v.getMessage())
          .sorted()
          .toList();
      throw new ActionInputException(definition.id(), reasons);
    }
    return input;
  }
}
