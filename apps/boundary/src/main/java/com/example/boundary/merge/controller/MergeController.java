package com.example.boundary.merge.controller;

import com.example.boundary.common.util.StringSanitizer;
import com.example.boundary.identity.model.Actor;
import com.example.boundary.merge.engine.MergeEngine;
import com.example.boundary.merge.model.MergeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Set;

@Slf4j
@RestController
@RequestMapping("/api/v1/couples")
@RequiredArgsConstructor
public class MergeController {

    private static final Set<String> UNAVAILABLE_REASONS = Set.of("STORAGE_UNAVAILABLE", "LOCK_TIMEOUT");

    private final MergeEngine mergeEngine;

    @PostMapping("/{coupleId}/merge")
    public Mono<ResponseEntity<MergeResult>> merge(Actor actor, @PathVariable String coupleId) {
        if (!StringSanitizer.isValidSafeId(coupleId)) {
            return Mono.error(new IllegalArgumentException("Invalid couple id"));
        }
        log.debug("POST /{}/merge - user: {}", StringSanitizer.forLog(coupleId), actor.userId());

        return mergeEngine.merge(coupleId, actor)
                .map(result -> ResponseEntity.status(statusOf(result)).body(result));
    }

    /**
     * HTTP status for a merge outcome. Failures caused by an unavailable dependency are 503 so
     * callers know a retry may succeed.
     */
    public static HttpStatus statusOf(MergeResult result) {
        return switch (result.state()) {
            case COMPLETED -> HttpStatus.OK;
            case REJECTED -> HttpStatus.FORBIDDEN;
            case FAILED -> UNAVAILABLE_REASONS.contains(result.reasonCode())
                    ? HttpStatus.SERVICE_UNAVAILABLE
                    : HttpStatus.UNPROCESSABLE_ENTITY;
            default -> throw new IllegalStateException("Non-terminal merge result " + result.state());
        };
    }
}
