package com.example.boundary.merge.engine;

import com.example.boundary.merge.model.MergeState;

/**
 * Receives every state transition of every merge invocation, on the thread making the transition.
 */
@FunctionalInterface
public interface MergeStateListener {

    void onTransition(MergeInvocation invocation, MergeState from, MergeState to);
}
