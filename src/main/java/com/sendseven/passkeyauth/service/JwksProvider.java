package com.sendseven.passkeyauth.service;

import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.sendseven.passkeyauth.config.IdentityProviderProperties;
import com.sendseven.passkeyauth.exception.IdentityVerificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Fetches and caches the identity provider's JSON Web Key Set.
 */
@Component
public class JwksProvider {

    private static final Logger logger = LoggerFactory.getLogger(JwksProvider.class);
    private static final long JWKS_CACHE_DURATION_MS = 3600 * 1000; // 1 hour

    private final WebClient webClient;
    private final IdentityProviderProperties properties;
    private final Clock clock;

    private volatile JWKSet jwksCache;
    private volatile long jwksCacheTime = 0;

    public JwksProvider(WebClient identityProviderWebClient, IdentityProviderProperties properties, Clock clock) {
        this.webClient = identityProviderWebClient;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Find a signing key by key id.
     *
     * A key id missing from the cached set triggers one refetch, to pick up
     * rotated keys before the cache would expire.
     *
     * @param kid The key ID from the JWT header
     * @return The key, or null if the provider does not publish it
     */
    public JWK getKey(String kid) {
        JWK key = getJWKS(false).getKeyByKeyId(kid);
        if (key == null) {
            logger.info("Key {} not in cached JWKS, refreshing", kid);
            key = getJWKS(true).getKeyByKeyId(kid);
        }
        return key;
    }

    /**
     * Fetch the JSON Web Key Set, caching the result for 1 hour.
     */
    synchronized JWKSet getJWKS(boolean forceRefresh) {
        long now = clock.millis();

        if (!forceRefresh && jwksCache != null && (now - jwksCacheTime) < JWKS_CACHE_DURATION_MS) {
            return jwksCache;
        }

        String jwksUri = properties.getJwksUri();
        logger.info("Fetching JWKS from: {}", jwksUri);

        try {
            String json = webClient.get()
                    .uri(jwksUri)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(properties.getExchangeTimeout())
                    .block();
            JWKSet jwkSet = JWKSet.parse(json);
            jwksCache = jwkSet;
            jwksCacheTime = now;
            return jwkSet;
        } catch (Exception e) {
            logger.error("Failed to fetch JWKS", e);
            throw new IdentityVerificationException("Failed to fetch JWKS: " + e.getMessage(), e);
        }
    }
}
