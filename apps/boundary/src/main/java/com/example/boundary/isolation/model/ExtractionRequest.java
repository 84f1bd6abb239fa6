package com.example.boundary.isolation.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Extraction request body.
 *
 * @param policyId whitelist policy to project through
 * @param version  context version, latest when null
 * @param fields   fields the caller intends to read, the whole policy when null or empty
 */
public record ExtractionRequest(
        @NotBlank @Size(max = 64) @Pattern(regexp = "^[a-zA-Z0-9_.-]+$") String policyId,
        @Nullable @Positive Long version,
        @Nullable @Size(max = 100) List<@NotBlank @Size(max = 64) String> fields
) {
}
