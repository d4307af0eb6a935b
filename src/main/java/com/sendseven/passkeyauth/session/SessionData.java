package com.sendseven.passkeyauth.session;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * Authentication data carried in the user's session.
 *
 * Holds the pending handshake (CSRF state and PKCE verifier) between the
 * redirect to the identity provider and the callback, and afterwards the
 * authenticated user's id. The state value and the code verifier are always
 * set and cleared together.
 */
public class SessionData implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * CSRF state value sent to the identity provider
     */
    private String stateValue;

    /**
     * PKCE code verifier, never sent to the identity provider before the exchange
     */
    private String codeVerifier;

    /**
     * When the pending handshake was started
     */
    private Instant pendingSince;

    /**
     * Application user id, set only after a successful exchange
     */
    private String userId;

    /**
     * When the user was authenticated
     */
    private Instant authenticatedAt;

    // Constructors
    public SessionData() {}

    /**
     * Returns an independent copy, used to apply updates atomically.
     */
    public SessionData copy() {
        SessionData copy = new SessionData();
        copy.stateValue = stateValue;
        copy.codeVerifier = codeVerifier;
        copy.pendingSince = pendingSince;
        copy.userId = userId;
        copy.authenticatedAt = authenticatedAt;
        return copy;
    }

    // Getters
    public String getStateValue() {
        return stateValue;
    }

    public String getCodeVerifier() {
        return codeVerifier;
    }

    public Instant getPendingSince() {
        return pendingSince;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getAuthenticatedAt() {
        return authenticatedAt;
    }

    // Pending handshake

    public void startHandshake(String stateValue, String codeVerifier, Instant now) {
        if (stateValue == null || codeVerifier == null) {
            throw new IllegalArgumentException("state value and code verifier are both required");
        }
        this.stateValue = stateValue;
        this.codeVerifier = codeVerifier;
        this.pendingSince = now;
    }

    public void clearPendingHandshake() {
        this.stateValue = null;
        this.codeVerifier = null;
        this.pendingSince = null;
    }

    public boolean hasPendingHandshake() {
        return stateValue != null && codeVerifier != null;
    }

    /**
     * Check if the pending handshake is older than the given time-to-live.
     */
    public boolean isPendingExpired(Instant now, Duration ttl) {
        return pendingSince == null || !pendingSince.plus(ttl).isAfter(now);
    }

    // Authentication

    public void authenticate(String userId, Instant now) {
        this.userId = userId;
        this.authenticatedAt = now;
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    @Override
    public String toString() {
        return "SessionData{" +
                "pending=" + hasPendingHandshake() +
                ", pendingSince=" + pendingSince +
                ", userId='" + userId + '\'' +
                ", authenticatedAt=" + authenticatedAt +
                '}';
    }
}
