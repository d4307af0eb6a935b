package com.sendseven.passkeyauth.exception;

/**
 * The authorization code could not be exchanged for tokens.
 *
 * Carries the provider's HTTP status and response body when the provider answered.
 */
public class TokenExchangeException extends AuthHandshakeException {

    private final Integer statusCode;
    private final String responseBody;

    public TokenExchangeException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public TokenExchangeException(String message, Integer statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    @Override
    public String getErrorCode() {
        return "token_exchange_failed";
    }
}
