package com.example.boundary.context.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Versioned therapeutic context of one client, as supplied by the context store.
 */
public record ClientContext(
        @NonNull String clientId,
        @NonNull String therapistId,
        long version,
        @NonNull Map<String, ContextField> fields
) {
    public ClientContext {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId is required");
        }
        if (therapistId == null || therapistId.isBlank()) {
            throw new IllegalArgumentException("therapistId is required");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version must not be negative");
        }
        if (fields == null) {
            fields = Map.of();
        }
        fields.forEach((key, field) -> {
            if (!key.equals(field.name())) {
                throw new IllegalArgumentException("Field key does not match field name: " + key);
            }
        });
        fields = Map.copyOf(fields);
    }

    @NonNull
    public static ClientContext of(
            @NonNull String clientId,
            @NonNull String therapistId,
            long version,
            @NonNull Collection<ContextField> fields) {
        Map<String, ContextField> byName = new LinkedHashMap<>();
        for (ContextField field : fields) {
            if (byName.put(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate context field: " + field.name());
            }
        }
        return new ClientContext(clientId, therapistId, version, byName);
    }

    @NonNull
    public Optional<ContextField> field(@Nullable String name) {
        return Optional.ofNullable(name == null ? null : fields.get(name));
    }
}
