package com.example.boundary.isolation.model;

import com.example.boundary.context.model.ContextField;
import org.springframework.lang.NonNull;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Projection of one client context through one whitelist policy.
 * Field names are a subset of the policy's allowed fields.
 */
public record AbstractedView(
        @NonNull String clientId,
        long contextVersion,
        @NonNull String policyId,
        int policyVersion,
        @NonNull SortedMap<String, ContextField> fields
) {
    public AbstractedView {
        fields = Collections.unmodifiableSortedMap(new TreeMap<>(fields));
    }

    @NonNull
    public List<String> values(@NonNull String fieldName) {
        ContextField field = fields.get(fieldName);
        return field == null ? List.of() : field.values();
    }
}
