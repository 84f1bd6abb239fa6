package com.example.boundary.merge.engine;

import com.example.boundary.merge.model.MergeState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

import java.util.List;
import java.util.UUID;

/**
 * State holder for one merge request. Illegal transitions throw {@link IllegalStateException}.
 */
@Slf4j
public final class MergeInvocation {

    private final String coupleId;
    private final String invocationId;
    private final List<MergeStateListener> listeners;
    private MergeState state = MergeState.REQUESTED;

    MergeInvocation(@NonNull String coupleId, @NonNull List<MergeStateListener> listeners) {
        this.coupleId = coupleId;
        this.invocationId = UUID.randomUUID().toString();
        this.listeners = listeners;
    }

    public String coupleId() {
        return coupleId;
    }

    public String invocationId() {
        return invocationId;
    }

    public synchronized MergeState state() {
        return state;
    }

    synchronized void transitionTo(@NonNull MergeState next) {
        MergeState from = state;
        if (!from.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal merge transition " + from + " -> " + next);
        }
        state = next;
        for (MergeStateListener listener : listeners) {
            try {
                listener.onTransition(this, from, next);
            } catch (RuntimeException e) {
                log.warn("Merge state listener {} failed on {} -> {}: {}",
                        listener.getClass().getSimpleName(), from, next, e.getMessage());
            }
        }
    }
}
