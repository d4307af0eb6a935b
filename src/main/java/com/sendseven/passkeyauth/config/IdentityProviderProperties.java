package com.sendseven.passkeyauth.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Beyond Identity application settings.
 *
 * Every identifier is required; the application refuses to start when one is
 * missing instead of redirecting users to a malformed provider URL.
 */
@Validated
@ConfigurationProperties(prefix = "beyond-identity")
public class IdentityProviderProperties {

    @NotBlank
    private String baseUrl = "https://auth-us.beyondidentity.com";

    @NotBlank
    private String tenantId;

    @NotBlank
    private String realmId;

    @NotBlank
    private String applicationId;

    @NotBlank
    private String clientId;

    @NotBlank
    private String clientSecret;

    @NotBlank
    private String redirectUri;

    /**
     * Expected ID token issuer. Defaults to the application URL.
     */
    private String issuer;

    @NotNull
    private Duration exchangeTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration handshakeTtl = Duration.ofMinutes(10);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getRealmId() {
        return realmId;
    }

    public void setRealmId(String realmId) {
        this.realmId = realmId;
    }

    public String getApplicationId() {
        return applicationId;
    }

    public void setApplicationId(String applicationId) {
        this.applicationId = applicationId;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
        this.clientSecret = clientSecret;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public void setRedirectUri(String redirectUri) {
        this.redirectUri = redirectUri;
    }

    public String getIssuer() {
        return issuer != null && !issuer.isBlank() ? issuer : getApplicationUrl();
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public Duration getExchangeTimeout() {
        return exchangeTimeout;
    }

    public void setExchangeTimeout(Duration exchangeTimeout) {
        this.exchangeTimeout = exchangeTimeout;
    }

    public Duration getHandshakeTtl() {
        return handshakeTtl;
    }

    public void setHandshakeTtl(Duration handshakeTtl) {
        this.handshakeTtl = handshakeTtl;
    }

    // =========================================================================
    // Derived endpoints
    // =========================================================================

    /**
     * Base URL of the application within the tenant and realm, without trailing slash.
     */
    public String getApplicationUrl() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/v1/tenants/" + tenantId + "/realms/" + realmId + "/applications/" + applicationId;
    }

    public String getAuthorizationEndpoint() {
        return getApplicationUrl() + "/authorize";
    }

    public String getTokenEndpoint() {
        return getApplicationUrl() + "/token";
    }

    public String getUserinfoEndpoint() {
        return getApplicationUrl() + "/userinfo";
    }

    public String getJwksUri() {
        return getApplicationUrl() + "/.well-known/jwks.json";
    }
}
