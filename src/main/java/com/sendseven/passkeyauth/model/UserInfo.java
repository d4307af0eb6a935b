package com.sendseven.passkeyauth.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User information from the userinfo endpoint.
 *
 * Used when the token response carries no ID token.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserInfo {

    /**
     * Subject identifier (unique user ID)
     */
    @JsonProperty("sub")
    private String sub;

    @JsonProperty("preferred_username")
    private String preferredUsername;

    @JsonProperty("email")
    private String email;

    @JsonProperty("name")
    private String name;

    // Constructors
    public UserInfo() {}

    // Getters and Setters
    public String getSub() {
        return sub;
    }

    public void setSub(String sub) {
        this.sub = sub;
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
        return ProviderIdentity.of(sub, preferredUsername, email, name);
    }

    @Override
    public String toString() {
        return "UserInfo{" +
                "sub='" + sub + '\'' +
                ", preferredUsername='" + preferredUsername + '\'' +
                '}';
    }
}
