package com.example.boundary.config;

import com.example.boundary.config.properties.WhitelistPolicyProperties;
import com.example.boundary.isolation.model.WhitelistPolicy;
import com.example.boundary.isolation.policy.WhitelistPolicyRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashSet;
import java.util.List;

/**
 * Builds the policy registry from {@code boundary.isolation.policies}.
 * A misconfigured couples policy stops the application from starting.
 */
@Configuration
public class WhitelistPolicyConfig {

    @Bean
    public WhitelistPolicyRegistry whitelistPolicyRegistry(WhitelistPolicyProperties properties) {
        List<WhitelistPolicy> policies = properties.policies().stream()
                .map(definition -> new WhitelistPolicy(
                        definition.id(),
                        definition.version(),
                        definition.mode(),
                        definition.scope(),
                        new HashSet<>(definition.allowedFields()),
                        definition.active()))
                .toList();
        return new WhitelistPolicyRegistry(policies, properties.couplesPolicyId());
    }
}
