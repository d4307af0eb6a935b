package com.sendseven.passkeyauth.service;

import com.sendseven.passkeyauth.exception.IdentityVerificationException;
import com.sendseven.passkeyauth.model.ProviderIdentity;
import com.sendseven.passkeyauth.model.TokenResponse;
import org.springframework.stereotype.Service;

/**
 * Establishes who logged in from a token response: from the verified ID token
 * when there is one, otherwise from the userinfo endpoint.
 */
@Service
public class ProviderIdentityResolver {

    private final IdTokenVerifier idTokenVerifier;
    private final UserInfoClient userInfoClient;

    public ProviderIdentityResolver(IdTokenVerifier idTokenVerifier, UserInfoClient userInfoClient) {
        this.idTokenVerifier = idTokenVerifier;
        this.userInfoClient = userInfoClient;
    }

    /**
     * @throws IdentityVerificationException if no identity can be established
     */
    public ProviderIdentity resolve(TokenResponse tokens) {
        try {
            if (tokens.hasIdToken()) {
                return idTokenVerifier.verify(tokens.getIdToken()).toIdentity();
            }
            return userInfoClient.getUserInfo(tokens.getAccessToken()).toIdentity();
        } catch (IllegalArgumentException e) {
            throw new IdentityVerificationException(e.getMessage(), e);
        }
    }
}
