package com.example.boundary.merge.lock;

import com.example.boundary.config.BoundaryProperties;
import com.example.boundary.merge.exception.LockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Non-blocking FIFO mutual exclusion per key.
 *
 * <p>Each key maps to the tail of a queue of completion signals. A caller appends its own signal
 * behind the current tail, waits for the previous tail to complete, runs its work, then completes
 * its signal. A caller that gives up while waiting completes its signal too, but its successor still
 * waits for everything queued before it. Each waiter only references the one directly ahead of it,
 * and the key is removed once everything queued on it has finished.
 */
@Slf4j
@Component
public class CoupleLockRegistry {

    private final ConcurrentHashMap<String, Node> tails = new ConcurrentHashMap<>();
    private final Duration waitTimeout;

    @Autowired
    public CoupleLockRegistry(@NonNull BoundaryProperties properties) {
        this(properties.getMerge().getLockWaitTimeout());
    }

    CoupleLockRegistry(@NonNull Duration waitTimeout) {
        this.waitTimeout = waitTimeout;
    }

    /**
     * Runs the work while holding the lock for {@code key}. The lock is released on completion,
     * error or cancellation.
     *
     * @throws LockTimeoutException (as an error signal) when the wait exceeds the configured timeout
     */
    public <T> Mono<T> withLock(@NonNull String key, @NonNull Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            Node node = new Node();
            Sinks.Empty<Void> release = Sinks.empty();
            AtomicReference<Node> previous = new AtomicReference<>();
            tails.compute(key, (k, current) -> {
                previous.set(current);
                return node;
            });

            Mono<Void> ready = previous.get() == null ? Mono.empty() : previous.get().done.asMono();

            // done only once everything queued ahead has finished and this caller has let go
            Mono.when(ready, release.asMono())
                    .doOnSuccess(ignored -> {
                        node.done.tryEmitEmpty();
                        removeIfIdle(key, node);
                    })
                    .subscribe();

            return ready
                    .timeout(waitTimeout)
                    .onErrorMap(TimeoutException.class, e -> new LockTimeoutException(key))
                    .then(Mono.defer(work))
                    .doFinally(signal -> release.tryEmitEmpty());
        });
    }

    private void removeIfIdle(String key, Node node) {
        if (tails.remove(key, node)) {
            log.debug("Released idle lock for {}", key);
        }
    }

    /**
     * Number of keys with a holder or waiters.
     */
    public int activeKeys() {
        return tails.size();
    }

    private static final class Node {
        private final Sinks.Empty<Void> done = Sinks.empty();
    }
}
