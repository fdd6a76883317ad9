package com.koni.sessions.domain.exception;

/**
 * Exception thrown when aggregates are requested over zero events.
 * Signals a programming error: the upsert path always includes the inserted event.
 */
public class EmptyEventCollectionException extends RuntimeException {

    public EmptyEventCollectionException(String message) {
        super(message);
    }
}
