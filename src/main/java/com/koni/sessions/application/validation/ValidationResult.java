package com.koni.sessions.application.validation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Outcome of validating an event payload: every violated constraint, in check order.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ValidationResult {

    private final List<String> errors;

    public ValidationResult(List<String> errors) {
        this.errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
