package com.sendseven.passkeyauth.user;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * An application user, linked to an identity provider subject.
 */
public class User {

    private final String id;
    private final String externalId;
    private final String username;

    public User(String id, String externalId, String username) {
        this.id = Objects.requireNonNull(id, "id");
        this.externalId = Objects.requireNonNull(externalId, "externalId");
        this.username = username;
    }

    public String getId() {
        return id;
    }

    /**
     * Subject identifier issued by the identity provider.
     */
    @JsonIgnore
    public String getExternalId() {
        return externalId;
    }

    public String getUsername() {
        return username;
    }

    User withUsername(String newUsername) {
        return new User(id, externalId, newUsername);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof User)) return false;
        User user = (User) o;
        return id.equals(user.id) && externalId.equals(user.externalId) && Objects.equals(username, user.username);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, externalId, username);
    }

    @Override
    public String toString() {
        return "User{id='" + id + "', username='" + username + "'}";
    }
}
