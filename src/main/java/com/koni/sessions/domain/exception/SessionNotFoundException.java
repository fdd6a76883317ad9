package com.koni.sessions.domain.exception;

/**
 * Exception thrown when a session is queried that has never received an event.
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
    }
}
