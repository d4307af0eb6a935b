package com.sendseven.passkeyauth.session;

import java.util.function.Consumer;

/**
 * The current user's session, as seen by the login handshake.
 *
 * An instance is scoped to a single request and passed explicitly into every
 * handshake operation.
 */
public interface AuthSession {

    /**
     * Returns a snapshot of the session data. A user without a session gets an
     * empty snapshot; reading never creates a session.
     *
     * @return the current session data, never null
     */
    SessionData get();

    /**
     * Applies the mutator to a copy of the session data and stores the result.
     * Either every change made by the mutator is persisted or none is. The
     * session is created on first write. An exception thrown by the mutator
     * propagates unchanged and nothing is written.
     *
     * @param mutator changes to apply
     * @throws com.sendseven.passkeyauth.exception.SessionWriteException if the session cannot be written
     */
    void update(Consumer<SessionData> mutator);

    /**
     * Logs the user out by discarding the session. Safe to call when there is no session.
     */
    void destroy();
}
