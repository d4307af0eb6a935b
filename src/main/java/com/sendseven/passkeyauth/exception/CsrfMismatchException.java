package com.sendseven.passkeyauth.exception;

/**
 * The callback state does not match the state stored in the session.
 */
public class CsrfMismatchException extends AuthHandshakeException {

    public CsrfMismatchException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "invalid_state";
    }
}
