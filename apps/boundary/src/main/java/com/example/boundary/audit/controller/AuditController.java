package com.example.boundary.audit.controller;

import com.example.boundary.audit.model.AuditEntry;
import com.example.boundary.audit.service.AuditRecorder;
import com.example.boundary.common.util.StringSanitizer;
import com.example.boundary.identity.exception.AuthorizationException;
import com.example.boundary.identity.model.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Instant;

/**
 * Compliance read path over the audit trail. Exactly one selector per request: a resource id, an
 * actor, or a time range.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditRecorder auditRecorder;

    @GetMapping
    public Flux<AuditEntry> find(
            Actor actor,
            @RequestParam(required = false) String resourceId,
            @RequestParam(name = "actor", required = false) String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {

        if (!actor.isComplianceOfficer()) {
            return Flux.error(new AuthorizationException("ROLE_NOT_PERMITTED",
                    "Audit reads require the compliance officer role"));
        }

        int selectors = (resourceId != null ? 1 : 0) + (userId != null ? 1 : 0)
                + (from != null || to != null ? 1 : 0);
        if (selectors != 1) {
            return Flux.error(new IllegalArgumentException("Exactly one of resourceId, actor or from/to is required"));
        }

        log.info("Audit read by {}: resourceId={}, actor={}, from={}, to={}", actor.userId(),
                StringSanitizer.forLog(resourceId), StringSanitizer.forLog(userId), from, to);

        if (resourceId != null) {
            return auditRecorder.findByResourceId(resourceId);
        }
        if (userId != null) {
            return auditRecorder.findByActor(userId);
        }
        if (from == null || to == null) {
            return Flux.error(new IllegalArgumentException("Both from and to are required for a time range"));
        }
        return auditRecorder.findBetween(from, to);
    }
}
