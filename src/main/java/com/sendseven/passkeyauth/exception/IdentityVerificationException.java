package com.sendseven.passkeyauth.exception;

/**
 * The authenticated identity could not be established from the token response.
 */
public class IdentityVerificationException extends AuthHandshakeException {

    public IdentityVerificationException(String message) {
        super(message);
    }

    public IdentityVerificationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "id_token_verification_failed";
    }
}
