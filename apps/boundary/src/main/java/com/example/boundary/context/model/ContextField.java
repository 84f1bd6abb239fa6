package com.example.boundary.context.model;

import org.springframework.lang.NonNull;

import java.util.List;
import java.util.Objects;

/**
 * A single named field of a client context. The sensitivity tag is mandatory.
 */
public record ContextField(
        @NonNull String name,
        @NonNull Sensitivity sensitivity,
        @NonNull List<String> values
) {
    public ContextField {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Context field name is required");
        }
        Objects.requireNonNull(sensitivity, () -> "Sensitivity is required for field " + name);
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static ContextField of(@NonNull String name, @NonNull Sensitivity sensitivity, @NonNull String value) {
        return new ContextField(name, sensitivity, List.of(value));
    }

    public static ContextField of(@NonNull String name, @NonNull Sensitivity sensitivity, @NonNull List<String> values) {
        return new ContextField(name, sensitivity, values);
    }
}
