package com.sendseven.passkeyauth.exception;

/**
 * The callback is missing its code or state parameter.
 */
public class MalformedCallbackException extends AuthHandshakeException {

    public MalformedCallbackException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "invalid_request";
    }
}
