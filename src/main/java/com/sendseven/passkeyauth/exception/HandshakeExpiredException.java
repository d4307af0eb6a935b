package com.sendseven.passkeyauth.exception;

/**
 * The pending handshake outlived its time-to-live.
 */
public class HandshakeExpiredException extends AuthHandshakeException {

    public HandshakeExpiredException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "session_expired";
    }
}
