package com.sendseven.passkeyauth.exception;

/**
 * The session does not reference an existing user.
 */
public class UserNotFoundException extends AuthHandshakeException {

    public UserNotFoundException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "user_not_found";
    }
}
