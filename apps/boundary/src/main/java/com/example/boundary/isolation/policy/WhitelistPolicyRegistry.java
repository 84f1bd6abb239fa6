package com.example.boundary.isolation.policy;

import com.example.boundary.isolation.exception.PolicyViolationException;
import com.example.boundary.isolation.model.PolicyScope;
import com.example.boundary.isolation.model.WhitelistPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the configured whitelist policies and the id of the couples policy.
 *
 * <p>Construction fails unless the couples policy exists, is COUPLES scoped, and is strictly
 * narrower than every active SAME_CLIENT policy.
 */
@Slf4j
public class WhitelistPolicyRegistry {

    private final Map<String, WhitelistPolicy> policies;
    private final WhitelistPolicy couplesPolicy;

    public WhitelistPolicyRegistry(@NonNull Collection<WhitelistPolicy> policies, @NonNull String couplesPolicyId) {
        Map<String, WhitelistPolicy> byId = new LinkedHashMap<>();
        for (WhitelistPolicy policy : policies) {
            if (byId.put(policy.id(), policy) != null) {
                throw new IllegalStateException("Duplicate whitelist policy id: " + policy.id());
            }
        }
        this.policies = Map.copyOf(byId);

        WhitelistPolicy couples = byId.get(couplesPolicyId);
        if (couples == null || !couples.active()) {
            throw new IllegalStateException("Couples policy is not configured or inactive: " + couplesPolicyId);
        }
        if (couples.scope() != PolicyScope.COUPLES) {
            throw new IllegalStateException("Couples policy must have COUPLES scope: " + couplesPolicyId);
        }
        List<String> notNarrower = byId.values().stream()
                .filter(WhitelistPolicy::active)
                .filter(p -> p.scope() == PolicyScope.SAME_CLIENT)
                .filter(p -> !couples.isStrictlyNarrowerThan(p))
                .map(WhitelistPolicy::id)
                .toList();
        if (!notNarrower.isEmpty()) {
            throw new IllegalStateException(
                    "Couples policy " + couplesPolicyId + " must be strictly narrower than " + notNarrower);
        }
        this.couplesPolicy = couples;

        log.info("Loaded {} whitelist policies, couples policy {} v{}",
                byId.size(), couples.id(), couples.version());
    }

    /**
     * Resolves an active policy.
     *
     * @throws PolicyViolationException for unknown or inactive ids
     */
    @NonNull
    public WhitelistPolicy resolve(@NonNull String policyId) {
        WhitelistPolicy policy = policies.get(policyId);
        if (policy == null) {
            throw PolicyViolationException.unknownPolicy(policyId);
        }
        if (!policy.active()) {
            throw PolicyViolationException.inactivePolicy(policyId);
        }
        return policy;
    }

    @NonNull
    public WhitelistPolicy couplesPolicy() {
        return couplesPolicy;
    }

    @NonNull
    public Collection<WhitelistPolicy> all() {
        return policies.values();
    }
}
