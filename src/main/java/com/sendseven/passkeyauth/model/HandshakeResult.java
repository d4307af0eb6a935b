package com.sendseven.passkeyauth.model;

import com.sendseven.passkeyauth.exception.AuthHandshakeException;
import com.sendseven.passkeyauth.session.HandshakeState;

import java.util.Optional;

/**
 * Outcome of handling a callback: where to send the browser and, on failure, why.
 *
 * The error is for diagnostics only and is never rendered to the browser.
 */
public final class HandshakeResult {

    private final HandshakeState state;
    private final String redirectTarget;
    private final AuthHandshakeException error;

    private HandshakeResult(HandshakeState state, String redirectTarget, AuthHandshakeException error) {
        this.state = state;
        this.redirectTarget = redirectTarget;
        this.error = error;
    }

    public static HandshakeResult success(String redirectTarget) {
        return new HandshakeResult(HandshakeState.EXCHANGED, redirectTarget, null);
    }

    public static HandshakeResult rejected(String redirectTarget, AuthHandshakeException error) {
        return new HandshakeResult(HandshakeState.REJECTED, redirectTarget, error);
    }

    public HandshakeState getState() {
        return state;
    }

    public String getRedirectTarget() {
        return redirectTarget;
    }

    public Optional<AuthHandshakeException> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() {
        return state == HandshakeState.EXCHANGED;
    }

    @Override
    public String toString() {
        return "HandshakeResult{state=" + state +
                ", redirectTarget='" + redirectTarget + '\'' +
                ", error=" + (error != null ? error.getErrorCode() : "none") +
                '}';
    }
}
