package com.sendseven.passkeyauth.service;

import com.sendseven.passkeyauth.config.IdentityProviderProperties;
import com.sendseven.passkeyauth.exception.AuthHandshakeException;
import com.sendseven.passkeyauth.exception.CsrfMismatchException;
import com.sendseven.passkeyauth.exception.HandshakeExpiredException;
import com.sendseven.passkeyauth.exception.MalformedCallbackException;
import com.sendseven.passkeyauth.exception.SessionWriteException;
import com.sendseven.passkeyauth.model.AuthorizationRequestParams;
import com.sendseven.passkeyauth.model.CallbackParams;
import com.sendseven.passkeyauth.model.HandshakeResult;
import com.sendseven.passkeyauth.model.ProviderIdentity;
import com.sendseven.passkeyauth.model.TokenResponse;
import com.sendseven.passkeyauth.session.AuthSession;
import com.sendseven.passkeyauth.session.HandshakeState;
import com.sendseven.passkeyauth.session.SessionData;
import com.sendseven.passkeyauth.user.User;
import com.sendseven.passkeyauth.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Drives the login handshake with the identity provider.
 *
 * The handshake spans two independent requests: {@link #initiateAuth} stores the
 * state value and PKCE verifier in the session and sends the browser to the
 * provider; {@link #handleCallback} validates the redirect back, exchanges the
 * code and marks the session as authenticated. Nothing links the two requests
 * except the session.
 */
@Service
public class AuthHandshakeService {

    private static final Logger logger = LoggerFactory.getLogger(AuthHandshakeService.class);

    public static final String HOME_PATH = "/";
    public static final String LOGIN_PATH = "/login";

    private final CryptoNonceGenerator nonceGenerator;
    private final AuthorizationRequestBuilder authorizationRequestBuilder;
    private final TokenExchangeClient tokenExchangeClient;
    private final ProviderIdentityResolver identityResolver;
    private final UserRepository userRepository;
    private final SessionUserResolver sessionUserResolver;
    private final IdentityProviderProperties properties;
    private final Clock clock;

    public AuthHandshakeService(CryptoNonceGenerator nonceGenerator,
                                AuthorizationRequestBuilder authorizationRequestBuilder,
                                TokenExchangeClient tokenExchangeClient,
                                ProviderIdentityResolver identityResolver,
                                UserRepository userRepository,
                                SessionUserResolver sessionUserResolver,
                                IdentityProviderProperties properties,
                                Clock clock) {
        this.nonceGenerator = nonceGenerator;
        this.authorizationRequestBuilder = authorizationRequestBuilder;
        this.tokenExchangeClient = tokenExchangeClient;
        this.identityResolver = identityResolver;
        this.userRepository = userRepository;
        this.sessionUserResolver = sessionUserResolver;
        this.properties = properties;
        this.clock = clock;
    }

    // =========================================================================
    // Initiate
    // =========================================================================

    /**
     * Start a login.
     *
     * 1. Generate the CSRF state and the PKCE verifier/challenge
     * 2. Store state and verifier in the session, replacing any earlier pair
     * 3. Build the authorization URL
     *
     * @return the URL to redirect the browser to
     * @throws SessionWriteException if the session cannot be written; no redirect must happen then
     */
    public String initiateAuth(AuthSession session) {
        HandshakeState.of(session.get()).transitionTo(HandshakeState.PENDING);

        AuthorizationRequestParams params = nonceGenerator.newAuthorizationRequest();
        Instant now = clock.instant();
        session.update(data -> data.startHandshake(params.getState(), params.getCodeVerifier(), now));

        String authUrl = authorizationRequestBuilder.buildAuthorizationUrl(params.getState(), params.getCodeChallenge());
        logger.info("Redirecting to authorization URL: {}", authUrl);
        return authUrl;
    }

    // =========================================================================
    // Callback
    // =========================================================================

    /**
     * Complete a login from the identity provider's redirect.
     *
     * 1. Reject callbacks without code or state before touching the session
     * 2. Validate state against the session (CSRF protection)
     * 3. Reject handshakes older than the configured time-to-live
     * 4. Exchange the code with the stored PKCE verifier
     * 5. Establish the user and finalize the session
     *
     * Failures are returned, not thrown. The session is left unchanged on
     * every failure except an expired handshake, whose stale pair is cleared.
     *
     * @return where to send the browser, and the failure if there was one
     */
    public HandshakeResult handleCallback(AuthSession session, CallbackParams params) {
        if (!params.isComplete()) {
            if (params.isProviderError()) {
                logger.warn("Identity provider returned error: {} - {}", params.getError(), params.getErrorDescription());
            } else {
                logger.warn("The authentication response was malformed, returning the user to the home page");
            }
            return HandshakeResult.rejected(HOME_PATH,
                    new MalformedCallbackException("Missing code or state parameter"));
        }

        SessionData data = session.get();
        HandshakeState state = HandshakeState.of(data);

        // A session without a stored state never matches
        if (!params.getState().equals(data.getStateValue())) {
            logger.warn("CSRF state mismatch on callback, session is not in an auth-ready state (state={})", state);
            state.transitionTo(HandshakeState.REJECTED);
            return HandshakeResult.rejected(HOME_PATH,
                    new CsrfMismatchException("Callback state does not match the session"));
        }
        state = state.transitionTo(HandshakeState.CALLBACK_RECEIVED);

        if (data.isPendingExpired(clock.instant(), properties.getHandshakeTtl())) {
            logger.warn("Pending login started at {} has expired", data.getPendingSince());
            state.transitionTo(HandshakeState.REJECTED);
            clearExpiredHandshake(session);
            return HandshakeResult.rejected(HOME_PATH,
                    new HandshakeExpiredException("Authorization request has expired"));
        }

        try {
            TokenResponse tokens = tokenExchangeClient.exchange(params.getCode(), data.getCodeVerifier());
            ProviderIdentity identity = identityResolver.resolve(tokens);
            User user = userRepository.upsertByExternalId(identity.getSubject(), identity.getUsername());

            Instant now = clock.instant();
            session.update(sess -> {
                sess.clearPendingHandshake();
                sess.authenticate(user.getId(), now);
            });
            state.transitionTo(HandshakeState.EXCHANGED);

            logger.info("User authenticated successfully: {}", user);
            return HandshakeResult.success(HOME_PATH);
        } catch (AuthHandshakeException e) {
            logger.error("Login handshake failed ({}): {}", e.getErrorCode(), e.getMessage());
            state.transitionTo(HandshakeState.REJECTED);
            return HandshakeResult.rejected(HOME_PATH, e);
        }
    }

    private void clearExpiredHandshake(AuthSession session) {
        try {
            session.update(SessionData::clearPendingHandshake);
        } catch (SessionWriteException e) {
            // The stale pair stays; it is rejected again on the next callback
            logger.warn("Could not clear expired handshake: {}", e.getMessage());
        }
    }

    // =========================================================================
    // Session
    // =========================================================================

    /**
     * Logout - discard the session.
     *
     * @return the login entry point
     */
    public String logout(AuthSession session) {
        session.destroy();
        logger.info("User logged out");
        return LOGIN_PATH;
    }

    /**
     * @throws com.sendseven.passkeyauth.exception.UserNotFoundException if the session
     *         is not authenticated; the session has been destroyed by then
     */
    public User currentUser(AuthSession session) {
        return sessionUserResolver.resolveUser(session);
    }
}
