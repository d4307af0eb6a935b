package com.sendseven.passkeyauth.controller;

import com.sendseven.passkeyauth.exception.SessionWriteException;
import com.sendseven.passkeyauth.exception.UserNotFoundException;
import com.sendseven.passkeyauth.model.CallbackParams;
import com.sendseven.passkeyauth.model.HandshakeResult;
import com.sendseven.passkeyauth.service.AuthHandshakeService;
import com.sendseven.passkeyauth.session.AuthSession;
import com.sendseven.passkeyauth.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Auth Controller for the passkey login flow.
 *
 * Endpoints:
 * - GET /auth/login     - Initiate the login flow
 * - GET /auth/callback  - Identity provider callback
 * - GET /logout         - Logout
 * - GET /api/user       - Current user (JSON)
 *
 * Pages ("/" and "/login") are served by the UI.
 */
@Controller
public class AuthController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

    private final AuthHandshakeService authHandshakeService;

    public AuthController(AuthHandshakeService authHandshakeService) {
        this.authHandshakeService = authHandshakeService;
    }

    // =========================================================================
    // Login (Start Flow)
    // =========================================================================

    /**
     * Initiate the login and redirect the browser to the identity provider.
     */
    @GetMapping("/auth/login")
    public String login(AuthSession session) {
        return "redirect:" + authHandshakeService.initiateAuth(session);
    }

    // =========================================================================
    // Callback
    // =========================================================================

    /**
     * Handle the identity provider's redirect back to the application.
     *
     * Always redirects; failure details are only logged.
     */
    @GetMapping("/auth/callback")
    public String callback(
            @RequestParam(required = false) String code,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String error,
            @RequestParam(name = "error_description", required = false) String errorDescription,
            AuthSession session
    ) {
        HandshakeResult result = authHandshakeService.handleCallback(session,
                new CallbackParams(code, state, error, errorDescription));
        logger.debug("Callback handled: {}", result);
        return "redirect:" + result.getRedirectTarget();
    }

    // =========================================================================
    // Logout
    // =========================================================================

    @GetMapping("/logout")
    public String logout(AuthSession session) {
        return "redirect:" + authHandshakeService.logout(session);
    }

    // =========================================================================
    // API Endpoint
    // =========================================================================

    /**
     * API endpoint to get the current user as JSON.
     */
    @GetMapping("/api/user")
    @ResponseBody
    public User apiUser(AuthSession session) {
        return authHandshakeService.currentUser(session);
    }

    // =========================================================================
    // Errors
    // =========================================================================

    @ExceptionHandler(UserNotFoundException.class)
    public String handleUserNotFound(UserNotFoundException e) {
        logger.warn("Forcing re-login: {}", e.getMessage());
        return "redirect:" + AuthHandshakeService.LOGIN_PATH;
    }

    /**
     * The session could not store the pending login, so the browser is not sent
     * to the identity provider.
     */
    @ExceptionHandler(SessionWriteException.class)
    @ResponseBody
    public ResponseEntity<Map<String, String>> handleSessionWriteFailure(SessionWriteException e) {
        logger.error("Could not start login", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", e.getErrorCode(), "message", "Login is temporarily unavailable. Please try again."));
    }
}
