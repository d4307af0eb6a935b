package com.sendseven.passkeyauth.model;

/**
 * One-time values for a single authorization request.
 *
 * The code challenge is the S256 digest of the code verifier. Only the state
 * and the challenge are sent to the identity provider.
 */
public final class AuthorizationRequestParams {

    private final String state;
    private final String codeVerifier;
    private final String codeChallenge;

    public AuthorizationRequestParams(String state, String codeVerifier, String codeChallenge) {
        this.state = state;
        this.codeVerifier = codeVerifier;
        this.codeChallenge = codeChallenge;
    }

    public String getState() {
        return state;
    }

    public String getCodeVerifier() {
        return codeVerifier;
    }

    public String getCodeChallenge() {
        return codeChallenge;
    }

    @Override
    public String toString() {
        // The verifier stays out of logs
        return "AuthorizationRequestParams{state='" + state + "', codeChallenge='" + codeChallenge + "'}";
    }
}
