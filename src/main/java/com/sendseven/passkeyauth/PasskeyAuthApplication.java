package com.sendseven.passkeyauth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Passkey Login Example
 *
 * This application demonstrates how to sign users in with a Beyond Identity
 * passkey using the OAuth2 Authorization Code flow with PKCE.
 *
 * Features:
 * - PKCE (Proof Key for Code Exchange) bound to the user's session
 * - State parameter for CSRF protection
 * - Server-side authorization code exchange with HTTP Basic client authentication
 * - ID token verification using JWKS
 * - Session-backed user resolution with forced logout on stale sessions
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PasskeyAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(PasskeyAuthApplication.class, args);
    }
}
