package com.sendseven.passkeyauth.user;

import java.util.Optional;

/**
 * Storage of application users.
 * <p>
 * Implementations must be thread-safe.
 */
public interface UserRepository {

    /**
     * Finds a user by application id.
     *
     * @param id application user id
     * @return the user, or empty if none exists
     */
    Optional<User> findById(String id);

    /**
     * Returns the user linked to the given provider subject, creating it on first
     * login. An existing user's username is refreshed.
     *
     * @param externalId subject identifier issued by the identity provider
     * @param username   username reported by the identity provider
     * @return the stored user
     */
    User upsertByExternalId(String externalId, String username);

    /**
     * Deletes a user. Sessions still referencing the user are logged out on their next request.
     *
     * @param id application user id
     */
    void deleteById(String id);
}
