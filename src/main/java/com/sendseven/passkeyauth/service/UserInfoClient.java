package com.sendseven.passkeyauth.service;

import com.sendseven.passkeyauth.config.IdentityProviderProperties;
import com.sendseven.passkeyauth.exception.IdentityVerificationException;
import com.sendseven.passkeyauth.model.UserInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Client for the identity provider's userinfo endpoint.
 */
@Service
public class UserInfoClient {

    private static final Logger logger = LoggerFactory.getLogger(UserInfoClient.class);

    private final WebClient webClient;
    private final IdentityProviderProperties properties;

    public UserInfoClient(WebClient identityProviderWebClient, IdentityProviderProperties properties) {
        this.webClient = identityProviderWebClient;
        this.properties = properties;
    }

    /**
     * Fetch user information using the access token.
     *
     * @param accessToken The OAuth2 access token
     * @return The user info
     */
    public UserInfo getUserInfo(String accessToken) {
        String userinfoUrl = properties.getUserinfoEndpoint();
        logger.info("Fetching user info from: {}", userinfoUrl);

        UserInfo userInfo;
        try {
            userInfo = webClient.get()
                    .uri(userinfoUrl)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                    .retrieve()
                    .bodyToMono(UserInfo.class)
                    .timeout(properties.getExchangeTimeout())
                    .block();
        } catch (Exception e) {
            logger.error("Failed to fetch user info", e);
            throw new IdentityVerificationException("Failed to fetch user info: " + e.getMessage(), e);
        }

        if (userInfo == null || userInfo.getSub() == null || userInfo.getSub().isBlank()) {
            throw new IdentityVerificationException("User info did not contain a subject");
        }

        logger.info("User info fetched: {}", userInfo);
        return userInfo;
    }
}
