package com.koni.sessions.domain.exception;

/**
 * Exception thrown when a session scoped write loses against a concurrent writer:
 * the session version moved on since it was read, or a row that was absent at read
 * time got inserted by another transaction.
 * This is the conflict class that the upsert retry policy retries.
 */
public class SessionWriteConflictException extends RuntimeException {

    public SessionWriteConflictException(String message) {
        super(message);
    }

    public SessionWriteConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
