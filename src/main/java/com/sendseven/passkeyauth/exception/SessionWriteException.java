package com.sendseven.passkeyauth.exception;

/**
 * The session could not be written.
 */
public class SessionWriteException extends AuthHandshakeException {

    public SessionWriteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "session_unavailable";
    }
}
