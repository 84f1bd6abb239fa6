package com.example.boundary.isolation.gate;

import com.example.boundary.context.model.ClientContext;
import com.example.boundary.context.model.ContextField;
import com.example.boundary.isolation.exception.PolicyViolationException;
import com.example.boundary.isolation.model.AbstractedView;
import com.example.boundary.isolation.model.WhitelistPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Projects a client context through a whitelist policy. Pure and side-effect free apart from logging;
 * auditing is the caller's job.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>an inactive policy is refused</li>
 *   <li>requested fields default to the policy's allowed fields</li>
 *   <li>a requested field outside the policy fails a STRICT policy and is dropped by a PERMISSIVE one</li>
 *   <li>allowed fields missing from the context are left out</li>
 *   <li>a PHI_CRITICAL or PHI_SENSITIVE field fails any policy not scoped to the same client</li>
 * </ol>
 */
@Slf4j
@Component
public class IsolationGate {

    @NonNull
    public AbstractedView project(@NonNull ClientContext context, @NonNull WhitelistPolicy policy) {
        return project(context, policy, null);
    }

    @NonNull
    public AbstractedView project(
            @NonNull ClientContext context,
            @NonNull WhitelistPolicy policy,
            @Nullable Collection<String> requestedFields) {

        if (!policy.active()) {
            throw PolicyViolationException.inactivePolicy(policy.id());
        }

        Set<String> requested = requestedFields == null || requestedFields.isEmpty()
                ? policy.allowedFields()
                : new LinkedHashSet<>(requestedFields);

        List<String> unlisted = requested.stream()
                .filter(field -> !policy.allows(field))
                .sorted()
                .toList();
        if (!unlisted.isEmpty()) {
            if (policy.isStrict()) {
                throw new PolicyViolationException(policy.id(), "FIELD_NOT_WHITELISTED", unlisted);
            }
            log.info("Permissive policy {} dropped {} unlisted field(s) for context {}",
                    policy.id(), unlisted.size(), context.clientId());
        }

        SortedMap<String, ContextField> selected = new TreeMap<>();
        for (String name : requested) {
            if (!policy.allows(name)) {
                continue;
            }
            Optional<ContextField> field = context.field(name);
            field.ifPresent(f -> selected.put(name, f));
        }

        if (!policy.scope().allowsRestrictedFields()) {
            List<String> restricted = selected.values().stream()
                    .filter(f -> f.sensitivity().isRestricted())
                    .map(ContextField::name)
                    .toList();
            if (!restricted.isEmpty()) {
                throw new PolicyViolationException(policy.id(), "RESTRICTED_FIELD_OUT_OF_SCOPE", restricted);
            }
        }

        return new AbstractedView(context.clientId(), context.version(), policy.id(), policy.version(), selected);
    }
}
