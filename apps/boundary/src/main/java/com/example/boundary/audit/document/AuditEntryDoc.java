package com.example.boundary.audit.document;

import com.example.boundary.audit.model.AuditAction;
import com.example.boundary.audit.model.AuditEntry;
import com.example.boundary.audit.model.AuditResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * MongoDB document for an audit entry. Written once with insert, never updated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "audit_entries")
@CompoundIndexes({
        @CompoundIndex(name = "resource_time_idx", def = "{'resourceId': 1, 'timestamp': 1}"),
        @CompoundIndex(name = "user_time_idx", def = "{'userId': 1, 'timestamp': 1}")
})
public class AuditEntryDoc {

    @Id
    private String id;

    @Indexed
    private Instant timestamp;

    private String eventType;
    private String userId;
    private String actorRole;
    private AuditAction action;
    private String resourceType;
    private String resourceId;
    private AuditResult result;
    private String ipAddress;
    private String userAgent;
    private String correlationId;

    /**
     * Identifiers, codes and counts only.
     */
    private Map<String, Object> details;

    public static AuditEntryDoc fromEntry(AuditEntry entry) {
        return AuditEntryDoc.builder()
                .id(entry.id())
                .timestamp(entry.timestamp())
                .eventType(entry.eventType())
                .userId(entry.userId())
                .actorRole(entry.actorRole())
                .action(entry.action())
                .resourceType(entry.resourceType())
                .resourceId(entry.resourceId())
                .result(entry.result())
                .ipAddress(entry.ipAddress())
                .userAgent(entry.userAgent())
                .correlationId(entry.correlationId())
                .details(entry.details())
                .build();
    }

    public AuditEntry toEntry() {
        return new AuditEntry(id, timestamp, eventType, userId, actorRole, action, resourceType,
                resourceId, result, ipAddress, userAgent, correlationId, details);
    }
}
