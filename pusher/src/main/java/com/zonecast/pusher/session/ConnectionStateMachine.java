package com.zonecast.pusher.session;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Thread-safe holder of a connection's {@link ConnectionState}.
 * <p>
 * Transitions are compare-and-set, so concurrent close paths (client close, pong timeout,
 * ban) race safely and exactly one of them wins {@link #beginClosing()}.
 * </p>
 */
public class ConnectionStateMachine {
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);

    public ConnectionState current() {
        return state.get();
    }

    /**
     * Moves to {@code target}.
     *
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    public void transition(ConnectionState target) {
        while (true) {
            ConnectionState from = state.get();
            if (!from.canTransitionTo(target)) {
                throw new IllegalStateException("Illegal connection transition " + from + " -> " + target);
            }
            if (state.compareAndSet(from, target)) {
                return;
            }
        }
    }

    /**
     * Enters {@link ConnectionState#CLOSING} if the connection is not already closing or closed.
     *
     * @return true for the single caller that must run teardown
     */
    public boolean beginClosing() {
        while (true) {
            ConnectionState from = state.get();
            if (!from.canTransitionTo(ConnectionState.CLOSING)) {
                return false;
            }
            if (state.compareAndSet(from, ConnectionState.CLOSING)) {
                return true;
            }
        }
    }
}
