package com.example.boundary.query.controller;

import com.example.boundary.identity.model.Actor;
import com.example.boundary.query.dto.OutboundQueryRequest;
import com.example.boundary.query.model.QueryResult;
import com.example.boundary.query.service.OutboundQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/outbound")
@RequiredArgsConstructor
public class OutboundQueryController {

    private final OutboundQueryService outboundQueryService;

    @PostMapping("/query")
    public Mono<ResponseEntity<QueryResult>> query(Actor actor, @RequestBody OutboundQueryRequest request) {
        log.debug("POST /query - user: {}", actor.userId());

        return outboundQueryService.sanitizeAndQuery(request.text(), actor)
                .map(result -> ResponseEntity
                        .status(result.isAllowed() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY)
                        .body(result));
    }
}
