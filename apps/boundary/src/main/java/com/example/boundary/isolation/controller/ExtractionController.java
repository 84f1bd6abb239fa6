package com.example.boundary.isolation.controller;

import com.example.boundary.common.util.StringSanitizer;
import com.example.boundary.identity.model.Actor;
import com.example.boundary.isolation.model.ExtractionRequest;
import com.example.boundary.isolation.model.ExtractionResult;
import com.example.boundary.isolation.service.ExtractionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/contexts")
@RequiredArgsConstructor
public class ExtractionController {

    private final ExtractionService extractionService;

    @PostMapping("/{contextId}/extract")
    public Mono<ResponseEntity<ExtractionResult>> extract(
            Actor actor,
            @PathVariable String contextId,
            @Valid @RequestBody ExtractionRequest request) {

        if (!StringSanitizer.isValidSafeId(contextId)) {
            return Mono.error(new IllegalArgumentException("Invalid context id"));
        }
        log.debug("POST /{}/extract - user: {}, policy: {}",
                StringSanitizer.forLog(contextId), actor.userId(), StringSanitizer.forLog(request.policyId()));

        return extractionService.extract(contextId, request, actor)
                .map(result -> ResponseEntity.status(statusOf(result)).body(result));
    }

    static HttpStatus statusOf(ExtractionResult result) {
        return switch (result.outcome()) {
            case EXTRACTED -> HttpStatus.OK;
            case POLICY_VIOLATION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case DENIED -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }
}
