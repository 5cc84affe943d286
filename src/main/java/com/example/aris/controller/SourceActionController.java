package com.example.aris.controller;

import com.example.aris.response.ActionDefinitionResponse;
import com.example.aris.response.ActionResponse;
import com.example.aris.session.UserSessionManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/v1/sources/{sourceId}/actions")
@Tag(name = "Source actions", description = "Discover and run actions exposed by feed sources")
@RequiredArgsConstructor
public class SourceActionController {

  private final UserSessionManager sessionManager;

  @GetMapping
  @Operation(summary = "List the actions a source declares")
  public Mono<ResponseEntity<?>> list(@RequestHeader(FeedController.USER_HEADER) String userId,
                                      @PathVariable String sourceId) {
    return Mono.fromCallable(() -> sessionManager.getOrCreate(userId).getEngine())
        .flatMap(engine -> engine.listActions(sourceId))
        .<ResponseEntity<?>>map(actions -> ResponseEntity.ok(actions.values().stream()
            .map(ActionDefinitionResponse::from)
            .toList()))
        .onErrorResume(ex -> Mono.just(ApiErrors.toResponse(ex)));
  }

  @PostMapping("/{actionId}")
  @Operation(summary = "Run an action", description = "Runs outside the refresh cycle; pushing sources update the feed on their own.")
  public Mono<ResponseEntity<?>> execute(@RequestHeader(FeedController.USER_HEADER) String userId,
                                         @PathVariable String sourceId,
                                         @PathVariable String actionId,
                                         @RequestBody(required = false) Map<String, Object> params) {
    return Mono.fromCallable(() -> sessionManager.getOrCreate(userId).getEngine())
        .flatMap(engine -> engine.executeAction(sourceId, actionId, params)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty()))
        .<ResponseEntity<?>>map(result -> ResponseEntity.ok(ActionResponse.builder()
            .sourceId(sourceId)
            .actionId(actionId)
            .result(result.orElse(null))
            .build()))
        .onErrorResume(ex -> Mono.just(ApiErrors.toResponse(ex)));
  }
}
