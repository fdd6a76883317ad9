package com.koni.sessions.domain.exception;

/**
 * Exception thrown when ingesting an event fails for a reason other than validation.
 * Carries the idempotency key and session id of the failed request for logging.
 */
public class SessionIngestionException extends RuntimeException {

    private final String idempotencyKey;
    private final String sessionId;

    public SessionIngestionException(String idempotencyKey, String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.idempotencyKey = idempotencyKey;
        this.sessionId = sessionId;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public String getSessionId() {
        return sessionId;
    }
}
