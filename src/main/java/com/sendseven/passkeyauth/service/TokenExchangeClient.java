package com.sendseven.passkeyauth.service;

import com.sendseven.passkeyauth.config.IdentityProviderProperties;
import com.sendseven.passkeyauth.exception.TokenExchangeException;
import com.sendseven.passkeyauth.model.TokenResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Exchanges an authorization code and its PKCE verifier for tokens.
 *
 * Authorization codes are single-use, so a failed exchange is never retried.
 */
@Service
public class TokenExchangeClient {

    private static final Logger logger = LoggerFactory.getLogger(TokenExchangeClient.class);

    private final WebClient webClient;
    private final IdentityProviderProperties properties;

    public TokenExchangeClient(WebClient identityProviderWebClient, IdentityProviderProperties properties) {
        this.webClient = identityProviderWebClient;
        this.properties = properties;
    }

    /**
     * Exchange an authorization code for tokens.
     *
     * The client authenticates with HTTP Basic; the body carries the code,
     * the PKCE code verifier and the registered redirect URI.
     *
     * @param code         The authorization code from the callback
     * @param codeVerifier The PKCE code verifier stored at initiation
     * @return The token response
     * @throws TokenExchangeException on network errors, timeouts, non-2xx answers or an unusable body
     */
    public TokenResponse exchange(String code, String codeVerifier) {
        String tokenUrl = properties.getTokenEndpoint();
        logger.info("Exchanging code for tokens at: {}", tokenUrl);

        MultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("grant_type", "authorization_code");
        formData.add("code", code);
        formData.add("code_verifier", codeVerifier);
        formData.add("redirect_uri", properties.getRedirectUri());

        TokenResponse response;
        try {
            response = webClient.post()
                    .uri(tokenUrl)
                    .headers(headers -> headers.setBasicAuth(properties.getClientId(), properties.getClientSecret()))
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(BodyInserters.fromFormData(formData))
                    .retrieve()
                    .bodyToMono(TokenResponse.class)
                    .timeout(properties.getExchangeTimeout())
                    .block();
        } catch (WebClientResponseException e) {
            logger.error("Token exchange rejected: status={}, body={}",
                    e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new TokenExchangeException("Token endpoint returned " + e.getStatusCode().value(),
                    e.getStatusCode().value(), e.getResponseBodyAsString(), e);
        } catch (Exception e) {
            logger.error("Token exchange failed", e);
            throw new TokenExchangeException("Failed to exchange code for tokens: " + e.getMessage(), e);
        }

        if (response == null || !response.hasAccessToken()) {
            logger.error("Token exchange returned no access token: {}", response);
            throw new TokenExchangeException("Token response did not contain an access token", null);
        }

        logger.info("Token exchange successful: {}", response);
        return response;
    }
}
