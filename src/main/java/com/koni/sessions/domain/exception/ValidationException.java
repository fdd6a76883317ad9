package com.koni.sessions.domain.exception;

import java.util.List;

/**
 * Exception thrown when an incoming event payload fails structural or range checks.
 * Carries every violated constraint so the client can fix them in one round trip.
 * Validation failures are never retried and never cached by the idempotency ledger.
 */
public class ValidationException extends RuntimeException {

    private final List<String> errors;

    public ValidationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ValidationException(List<String> errors) {
        super("Validation failed: " + String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
