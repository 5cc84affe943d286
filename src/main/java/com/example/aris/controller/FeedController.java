package com.example.aris.controller;

import com.example.aris.model.FeedResult;
import com.example.aris.request.LocationUpdateRequest;
import com.example.aris.response.FeedResponse;
import com.example.aris.service.FeedEngine;
import com.example.aris.session.UserSessionManager;
import com.example.aris.source.location.LocationSource;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/v1")
@Tag(name = "Feed API", description = "Per-user feed and location updates")
@RequiredArgsConstructor
public class FeedController {

    public static final String USER_HEADER = "X-User-Id";

    private final UserSessionManager sessionManager;

    @GetMapping("/feed")
    @Operation(
            summary = "Current feed",
            description = "Returns the cached feed while it is fresh, otherwise refreshes every source first."
    )
    public Mono<ResponseEntity<?>> feed(@RequestHeader(USER_HEADER) String userId) {
        return Mono.fromCallable(() -> sessionManager.getOrCreate(userId).getEngine())
                .flatMap(FeedController::freshOrRefresh)
                .<ResponseEntity<?>>map(result -> ResponseEntity.ok(FeedResponse.from(result)))
                .onErrorResume(ex -> Mono.just(ApiErrors.toResponse(ex)));
    }

    @PostMapping("/location")
    @Operation(
            summary = "Update location",
            description = "Pushes a new location into the user's location source; dependent sources recompute."
    )
    public Mono<ResponseEntity<?>> updateLocation(@RequestHeader(USER_HEADER) String userId,
                                                  @RequestBody LocationUpdateRequest request) {
        return Mono.fromCallable(() -> sessionManager.getOrCreate(userId).getEngine())
                .flatMap(engine -> engine.executeAction(LocationSource.ID, LocationSource.UPDATE_LOCATION, request))
                .then(Mono.<ResponseEntity<?>>fromCallable(() -> ResponseEntity.noContent().build()))
                .onErrorResume(ex -> Mono.just(ApiErrors.toResponse(ex)));
    }

    private static Mono<FeedResult> freshOrRefresh(FeedEngine engine) {
        return engine.lastFeed()
                .map(Mono::just)
                .orElseGet(engine::refresh);
    }
}
