package com.example.boundary.audit.service;

import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Issues strictly increasing millisecond timestamps for this process, even when the
 * wall clock stalls or steps backwards.
 */
@Component
public class MonotonicClock {

    private final Clock clock;
    private Instant last = Instant.EPOCH;

    public MonotonicClock(@NonNull Clock clock) {
        this.clock = clock;
    }

    @NonNull
    public synchronized Instant next() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        last = now.isAfter(last) ? now : last.plusMillis(1);
        return last;
    }
}
