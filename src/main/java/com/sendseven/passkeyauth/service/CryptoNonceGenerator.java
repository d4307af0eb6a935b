package com.sendseven.passkeyauth.service;

import com.sendseven.passkeyauth.model.AuthorizationRequestParams;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * One-time values for the authorization request: CSRF state and PKCE
 * verifier/challenge.
 */
@Component
public class CryptoNonceGenerator {

    static final int NONCE_BYTES = 32;

    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom secureRandom;

    public CryptoNonceGenerator() {
        this(new SecureRandom());
    }

    CryptoNonceGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /**
     * Generate 32 random bytes, URL-safe base64 encoded without padding.
     *
     * Used both for the CSRF state and for the PKCE code verifier.
     *
     * @return a 43 character URL-safe string
     */
    public String generateNonce() {
        byte[] randomBytes = new byte[NONCE_BYTES];
        secureRandom.nextBytes(randomBytes);
        return URL_ENCODER.encodeToString(randomBytes);
    }

    /**
     * Generate the S256 code challenge for a code verifier.
     *
     * The code challenge is the Base64URL-encoded SHA-256 hash of the verifier.
     *
     * @param verifier The PKCE code verifier
     * @return The S256 code challenge
     */
    public String deriveChallenge(String verifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.UTF_8));
            return URL_ENCODER.encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Fresh state, verifier and matching challenge for one authorization request.
     */
    public AuthorizationRequestParams newAuthorizationRequest() {
        String state = generateNonce();
        String codeVerifier = generateNonce();
        return new AuthorizationRequestParams(state, codeVerifier, deriveChallenge(codeVerifier));
    }
}
