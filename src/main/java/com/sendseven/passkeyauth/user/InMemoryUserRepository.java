package com.sendseven.passkeyauth.user;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link UserRepository}. Users are lost on restart.
 */
public class InMemoryUserRepository implements UserRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryUserRepository.class);

    private final Map<String, User> usersById = new ConcurrentHashMap<>();
    private final Map<String, String> idsByExternalId = new ConcurrentHashMap<>();

    @Override
    public Optional<User> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(usersById.get(id));
    }

    @Override
    public User upsertByExternalId(String externalId, String username) {
        // Serialises concurrent first logins of the same subject
        String id = idsByExternalId.computeIfAbsent(externalId, key -> {
            String newId = UUID.randomUUID().toString();
            logger.info("Creating user {} for subject {}", newId, key);
            return newId;
        });
        return usersById.compute(id, (key, existing) ->
                existing == null ? new User(key, externalId, username) : existing.withUsername(username));
    }

    @Override
    public void deleteById(String id) {
        User removed = usersById.remove(id);
        if (removed != null) {
            idsByExternalId.remove(removed.getExternalId(), id);
            logger.info("Deleted user {}", id);
        }
    }
}
