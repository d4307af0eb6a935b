package com.sendseven.passkeyauth.model;

import java.util.Date;

/**
 * Verified ID token claims.
 *
 * Only the claims needed to identify the user are kept.
 */
public class IdTokenClaims {

    /**
     * Issuer (iss) - Who issued the token
     */
    private String issuer;

    /**
     * Subject (sub) - Unique user identifier at the identity provider
     */
    private String subject;

    /**
     * Expiration time (exp)
     */
    private Date expirationTime;

    /**
     * Preferred username, if the provider releases it
     */
    private String preferredUsername;

    /**
     * User's email
     */
    private String email;

    /**
     * User's name
     */
    private String name;

    // Constructors
    public IdTokenClaims() {}

    // Getters and Setters
    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public Date getExpirationTime() {
        return expirationTime;
    }

    public void setExpirationTime(Date expirationTime) {
        this.expirationTime = expirationTime;
    }

    public String getPreferredUsername() {
        return preferredUsername;
    }

    public void setPreferredUsername(String preferredUsername) {
        this.preferredUsername = preferredUsername;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public ProviderIdentity toIdentity() {
        return ProviderIdentity.of(subject, preferredUsername, email, name);
    }

    @Override
    public String toString() {
        return "IdTokenClaims{" +
                "issuer='" + issuer + '\'' +
                ", subject='" + subject + '\'' +
                ", preferredUsername='" + preferredUsername + '\'' +
                ", expirationTime=" + expirationTime +
                '}';
    }
}
