package com.sendseven.passkeyauth.service;

import com.sendseven.passkeyauth.exception.UserNotFoundException;
import com.sendseven.passkeyauth.session.AuthSession;
import com.sendseven.passkeyauth.user.User;
import com.sendseven.passkeyauth.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves the application user behind an authenticated session.
 *
 * A session that does not lead to an existing user is logged out; it never
 * carries on as an anonymous session.
 */
@Service
public class SessionUserResolver {

    private static final Logger logger = LoggerFactory.getLogger(SessionUserResolver.class);

    private final UserRepository userRepository;

    public SessionUserResolver(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * @param session the current session
     * @return the logged-in user
     * @throws UserNotFoundException if the session has no user id or the user no longer exists;
     *                               the session has been destroyed by then
     */
    public User resolveUser(AuthSession session) {
        String userId = session.get().getUserId();
        if (userId == null) {
            session.destroy();
            throw new UserNotFoundException("Session is not authenticated");
        }

        return userRepository.findById(userId).orElseThrow(() -> {
            logger.warn("Session references missing user {}, logging out", userId);
            session.destroy();
            return new UserNotFoundException("User not found: " + userId);
        });
    }
}
