package com.sendseven.passkeyauth.service;

import com.sendseven.passkeyauth.config.IdentityProviderProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Builds the URL that sends the browser to the identity provider's authorize endpoint.
 */
@Component
public class AuthorizationRequestBuilder {

    static final String SCOPE = "openid";
    static final String CODE_CHALLENGE_METHOD = "S256";

    private final IdentityProviderProperties properties;

    public AuthorizationRequestBuilder(IdentityProviderProperties properties) {
        this.properties = properties;
    }

    /**
     * Build the authorization URL.
     *
     * @param state     CSRF state value, echoed back on the callback
     * @param challenge PKCE S256 code challenge
     * @return The complete, encoded authorization URL
     */
    public String buildAuthorizationUrl(String state, String challenge) {
        return UriComponentsBuilder.fromHttpUrl(properties.getAuthorizationEndpoint())
                .queryParam("response_type", "code")
                .queryParam("client_id", properties.getClientId())
                .queryParam("redirect_uri", properties.getRedirectUri())
                .queryParam("scope", SCOPE)
                .queryParam("state", state)
                .queryParam("code_challenge_method", CODE_CHALLENGE_METHOD)
                .queryParam("code_challenge", challenge)
                .build()
                .encode()
                .toUriString();
    }
}
