package com.sendseven.passkeyauth.service;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.sendseven.passkeyauth.config.IdentityProviderProperties;
import com.sendseven.passkeyauth.exception.IdentityVerificationException;
import com.sendseven.passkeyauth.model.IdTokenClaims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.util.Date;

/**
 * Verifies ID tokens issued by the identity provider.
 */
@Service
public class IdTokenVerifier {

    private static final Logger logger = LoggerFactory.getLogger(IdTokenVerifier.class);
    private static final Duration CLOCK_SKEW = Duration.ofSeconds(60);

    private final JwksProvider jwksProvider;
    private final IdentityProviderProperties properties;
    private final Clock clock;

    public IdTokenVerifier(JwksProvider jwksProvider, IdentityProviderProperties properties, Clock clock) {
        this.jwksProvider = jwksProvider;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Verify an ID token and extract claims.
     *
     * Performs the following validations:
     * - RS256 signature verification using JWKS
     * - Issuer (iss) matches expected
     * - Audience (aud) contains client_id
     * - Token is not expired (exp), allowing one minute of clock skew
     *
     * @param idToken The ID token JWT
     * @return The verified ID token claims
     * @throws IdentityVerificationException if verification fails
     */
    public IdTokenClaims verify(String idToken) {
        SignedJWT signedJWT;
        JWTClaimsSet claims;
        try {
            signedJWT = SignedJWT.parse(idToken);
            claims = signedJWT.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new IdentityVerificationException("Invalid ID token format: " + e.getMessage(), e);
        }

        String kid = signedJWT.getHeader().getKeyID();
        JWSAlgorithm alg = signedJWT.getHeader().getAlgorithm();
        logger.debug("Verifying ID token with kid: {}, alg: {}", kid, alg);

        if (!JWSAlgorithm.RS256.equals(alg)) {
            throw new IdentityVerificationException("Unsupported ID token algorithm: " + alg);
        }

        JWK jwk = jwksProvider.getKey(kid);
        if (jwk == null) {
            throw new IdentityVerificationException("No matching key found for kid: " + kid);
        }
        if (!(jwk instanceof RSAKey)) {
            throw new IdentityVerificationException("Expected RSA key but got: " + jwk.getKeyType());
        }

        try {
            if (!signedJWT.verify(new RSASSAVerifier((RSAKey) jwk))) {
                throw new IdentityVerificationException("ID token signature verification failed");
            }
        } catch (JOSEException e) {
            throw new IdentityVerificationException("ID token signature verification failed: " + e.getMessage(), e);
        }

        String expectedIssuer = properties.getIssuer();
        if (!expectedIssuer.equals(claims.getIssuer())) {
            throw new IdentityVerificationException("Invalid issuer. Expected: " + expectedIssuer +
                    ", got: " + claims.getIssuer());
        }

        if (claims.getAudience() == null || !claims.getAudience().contains(properties.getClientId())) {
            throw new IdentityVerificationException("Invalid audience. Expected: " + properties.getClientId() +
                    ", got: " + claims.getAudience());
        }

        Date exp = claims.getExpirationTime();
        Date latestAccepted = Date.from(clock.instant().minus(CLOCK_SKEW));
        if (exp == null || exp.before(latestAccepted)) {
            throw new IdentityVerificationException("ID token has expired");
        }

        if (claims.getSubject() == null || claims.getSubject().isBlank()) {
            throw new IdentityVerificationException("ID token has no subject");
        }

        IdTokenClaims idTokenClaims = new IdTokenClaims();
        idTokenClaims.setIssuer(claims.getIssuer());
        idTokenClaims.setSubject(claims.getSubject());
        idTokenClaims.setExpirationTime(exp);
        idTokenClaims.setPreferredUsername(getStringClaim(claims, "preferred_username"));
        idTokenClaims.setEmail(getStringClaim(claims, "email"));
        idTokenClaims.setName(getStringClaim(claims, "name"));

        logger.info("ID token verified: {}", idTokenClaims);
        return idTokenClaims;
    }

    private String getStringClaim(JWTClaimsSet claims, String claimName) {
        try {
            return claims.getStringClaim(claimName);
        } catch (ParseException e) {
            logger.debug("Ignoring non-string claim {}", claimName);
            return null;
        }
    }
}
