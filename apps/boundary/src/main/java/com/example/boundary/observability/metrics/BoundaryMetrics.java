package com.example.boundary.observability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Counters for boundary decisions. Tag values are bounded enum names or policy ids.
 */
@Component
public class BoundaryMetrics {

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_FAILURE = "failure";
    private static final String TAG_UNKNOWN = "unknown";
    private static final int MAX_TAG_LENGTH = 50;

    private final MeterRegistry registry;

    private final Counter auditWriteSuccess;
    private final Counter auditWriteFailure;
    private final Counter auditWriteRetry;
    private final Counter sanitizeAllowed;
    private final Counter sanitizeBlocked;
    private final Timer mergeTimer;

    public BoundaryMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.auditWriteSuccess = Counter.builder("boundary.audit.write")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Audit entries persisted")
                .register(registry);

        this.auditWriteFailure = Counter.builder("boundary.audit.write")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Audit writes that exhausted retries")
                .register(registry);

        this.auditWriteRetry = Counter.builder("boundary.audit.write.retry")
                .description("Audit write retry attempts")
                .register(registry);

        this.sanitizeAllowed = Counter.builder("boundary.sanitize")
                .tag("decision", "allowed")
                .description("Outbound texts allowed")
                .register(registry);

        this.sanitizeBlocked = Counter.builder("boundary.sanitize")
                .tag("decision", "blocked")
                .description("Outbound texts blocked")
                .register(registry);

        this.mergeTimer = Timer.builder("boundary.merge.duration")
                .description("Couples merge duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordAuditWrite(boolean success) {
        if (success) {
            auditWriteSuccess.increment();
        } else {
            auditWriteFailure.increment();
        }
    }

    public void recordAuditRetry() {
        auditWriteRetry.increment();
    }

    public void recordExtract(@Nullable String outcome, @Nullable String policyId) {
        registry.counter("boundary.extract",
                Tags.of("outcome", sanitizeTag(outcome), "policy", sanitizeTag(policyId)))
                .increment();
    }

    public void recordMerge(@Nullable String state, @NonNull Duration duration) {
        mergeTimer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        registry.counter("boundary.merge", Tags.of("state", sanitizeTag(state))).increment();
    }

    public void recordSanitize(boolean allowed, @Nullable String reason) {
        if (allowed) {
            sanitizeAllowed.increment();
            return;
        }
        sanitizeBlocked.increment();
        registry.counter("boundary.sanitize.blocked.by_reason", Tags.of("reason", sanitizeTag(reason)))
                .increment();
    }

    @NonNull
    private String sanitizeTag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return TAG_UNKNOWN;
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_-]", "_");
        if (sanitized.length() > MAX_TAG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_TAG_LENGTH);
        }
        return sanitized.isBlank() ? TAG_UNKNOWN : sanitized;
    }
}
