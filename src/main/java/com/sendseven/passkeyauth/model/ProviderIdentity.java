package com.sendseven.passkeyauth.model;

import java.util.Objects;

/**
 * The user as identified by the identity provider.
 */
public final class ProviderIdentity {

    private final String subject;
    private final String username;

    public ProviderIdentity(String subject, String username) {
        this.subject = Objects.requireNonNull(subject, "subject");
        this.username = Objects.requireNonNull(username, "username");
    }

    /**
     * Picks the first available display name, falling back to the subject.
     */
    static ProviderIdentity of(String subject, String preferredUsername, String email, String name) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Identity has no subject");
        }
        String username = firstNonBlank(preferredUsername, email, name, subject);
        return new ProviderIdentity(subject, username);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    public String getSubject() {
        return subject;
    }

    public String getUsername() {
        return username;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProviderIdentity)) return false;
        ProviderIdentity that = (ProviderIdentity) o;
        return subject.equals(that.subject) && username.equals(that.username);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, username);
    }

    @Override
    public String toString() {
        return "ProviderIdentity{subject='" + subject + "', username='" + username + "'}";
    }
}
