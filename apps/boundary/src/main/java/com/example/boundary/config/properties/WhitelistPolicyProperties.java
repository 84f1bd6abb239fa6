package com.example.boundary.config.properties;

import com.example.boundary.isolation.model.PolicyMode;
import com.example.boundary.isolation.model.PolicyScope;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Whitelist policy definitions loaded from configuration.
 *
 * <p>Example:
 * <pre>
 * boundary:
 *   isolation:
 *     couples-policy-id: couples-framework
 *     policies:
 *       - id: couples-framework
 *         version: 1
 *         mode: STRICT
 *         scope: COUPLES
 *         allowed-fields: [themes, attachment_patterns]
 * </pre>
 */
@ConfigurationProperties(prefix = "boundary.isolation")
public record WhitelistPolicyProperties(
        @Nullable String couplesPolicyId,
        @Nullable List<PolicyDefinition> policies
) {
    public WhitelistPolicyProperties {
        if (couplesPolicyId == null || couplesPolicyId.isBlank()) {
            couplesPolicyId = "couples-framework";
        }
        if (policies == null) {
            policies = List.of();
        }
    }

    /**
     * A single named, versioned whitelist.
     */
    public record PolicyDefinition(
            @NonNull String id,
            int version,
            @Nullable PolicyMode mode,
            @Nullable PolicyScope scope,
            @Nullable Boolean active,
            @Nullable List<String> allowedFields
    ) {
        public PolicyDefinition {
            if (version <= 0) {
                version = 1;
            }
            if (mode == null) {
                mode = PolicyMode.STRICT;
            }
            if (scope == null) {
                scope = PolicyScope.SAME_CLIENT;
            }
            if (active == null) {
                active = Boolean.TRUE;
            }
            if (allowedFields == null) {
                allowedFields = List.of();
            }
        }
    }
}
