package com.example.boundary.query.controller;

import com.example.boundary.common.util.StringSanitizer;
import com.example.boundary.identity.model.Actor;
import com.example.boundary.merge.controller.MergeController;
import com.example.boundary.query.model.ResearchResult;
import com.example.boundary.query.service.ResearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/couples")
@RequiredArgsConstructor
public class ResearchController {

    private final ResearchService researchService;

    @PostMapping("/{coupleId}/research")
    public Mono<ResponseEntity<ResearchResult>> research(Actor actor, @PathVariable String coupleId) {
        if (!StringSanitizer.isValidSafeId(coupleId)) {
            return Mono.error(new IllegalArgumentException("Invalid couple id"));
        }
        log.debug("POST /{}/research - user: {}", StringSanitizer.forLog(coupleId), actor.userId());

        return researchService.research(coupleId, actor)
                .map(result -> ResponseEntity.status(MergeController.statusOf(result.merge())).body(result));
    }
}
