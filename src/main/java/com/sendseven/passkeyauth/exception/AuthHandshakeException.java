package com.sendseven.passkeyauth.exception;

/**
 * Base type for failures of the login handshake.
 *
 * None of these are fatal: each one ends with the browser redirected and the
 * session either untouched or cleared. Messages are for server-side logs only
 * and are never rendered to the user.
 */
public abstract class AuthHandshakeException extends RuntimeException {

    protected AuthHandshakeException(String message) {
        super(message);
    }

    protected AuthHandshakeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable error code, in the style of OAuth2 error codes.
     */
    public abstract String getErrorCode();
}
