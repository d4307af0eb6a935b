package com.sendseven.passkeyauth.session;

import com.sendseven.passkeyauth.exception.SessionWriteException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * {@link AuthSession} backed by the servlet container's {@link HttpSession}.
 *
 * The whole {@link SessionData} object is stored under a single attribute, so
 * an update replaces it in one write.
 */
public class HttpSessionAuthSession implements AuthSession {

    private static final Logger logger = LoggerFactory.getLogger(HttpSessionAuthSession.class);

    static final String SESSION_AUTH = "auth_session";

    private final HttpServletRequest request;

    public HttpSessionAuthSession(HttpServletRequest request) {
        this.request = request;
    }

    @Override
    public SessionData get() {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return new SessionData();
        }
        try {
            Object data = session.getAttribute(SESSION_AUTH);
            return data instanceof SessionData ? ((SessionData) data).copy() : new SessionData();
        } catch (IllegalStateException e) {
            // Invalidated earlier in this request
            return new SessionData();
        }
    }

    @Override
    public void update(Consumer<SessionData> mutator) {
        SessionData updated = get();
        mutator.accept(updated);

        try {
            HttpSession session = request.getSession(true);
            session.setAttribute(SESSION_AUTH, updated);
        } catch (RuntimeException e) {
            logger.error("Failed to write session", e);
            throw new SessionWriteException("Failed to write session: " + e.getMessage(), e);
        }
    }

    @Override
    public void destroy() {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return;
        }
        try {
            session.invalidate();
        } catch (IllegalStateException e) {
            logger.debug("Session was already invalidated");
        }
    }
}
