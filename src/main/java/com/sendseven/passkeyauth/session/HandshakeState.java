package com.sendseven.passkeyauth.session;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of the login handshake.
 *
 * <pre>
 * UNINITIATED -> PENDING -> CALLBACK_RECEIVED -> EXCHANGED
 *                                            \-> REJECTED
 * </pre>
 *
 * PENDING and EXCHANGED are persisted through the session contents; the other
 * states only exist while a request is being handled.
 */
public enum HandshakeState {

    UNINITIATED,
    PENDING,
    CALLBACK_RECEIVED,
    EXCHANGED,
    REJECTED;

    /**
     * Derives the persisted state from session contents.
     */
    public static HandshakeState of(SessionData data) {
        if (data.hasPendingHandshake()) {
            return PENDING;
        }
        if (data.isAuthenticated()) {
            return EXCHANGED;
        }
        return UNINITIATED;
    }

    public boolean canTransitionTo(HandshakeState next) {
        return allowedTransitions().contains(next);
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public HandshakeState transitionTo(HandshakeState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Invalid handshake transition " + this + " -> " + next);
        }
        return next;
    }

    public boolean isTerminal() {
        return this == EXCHANGED || this == REJECTED;
    }

    private Set<HandshakeState> allowedTransitions() {
        switch (this) {
            case UNINITIATED:
                return EnumSet.of(PENDING, REJECTED);
            case PENDING:
                // Initiating again replaces the pending pair
                return EnumSet.of(PENDING, CALLBACK_RECEIVED, REJECTED);
            case CALLBACK_RECEIVED:
                return EnumSet.of(EXCHANGED, REJECTED);
            case EXCHANGED:
                return EnumSet.of(PENDING, REJECTED);
            case REJECTED:
                return EnumSet.of(PENDING);
            default:
                return EnumSet.noneOf(HandshakeState.class);
        }
    }
}
