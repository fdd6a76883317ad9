package com.koni.sessions.application.validation;

import com.koni.sessions.application.command.IngestSessionEventCommand;
import com.koni.sessions.infrastructure.config.IngestionProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates raw event payloads against structural rules and configured range limits.
 *
 * All violations are collected so the client gets the complete list in one response:
 * - eventId, sessionId, userId and timestamp are required; identifiers are bounded in length
 * - the timestamp must parse and lie within the accepted window around now
 * - measures must be non-negative and under their maximum; steps must be integral
 */
@Component
public class SessionEventValidator {

    private final IngestionProperties.Validation limits;
    private final Clock clock;

    public SessionEventValidator(IngestionProperties properties, Clock clock) {
        this.limits = properties.getValidation();
        this.clock = clock;
    }

    public ValidationResult validate(IngestSessionEventCommand command) {
        List<String> errors = new ArrayList<>();

        requireIdentifier(command.getEventId(), "eventId", errors);
        requireIdentifier(command.getSessionId(), "sessionId", errors);
        requireIdentifier(command.getUserId(), "userId", errors);

        if (command.getTimestamp() == null) {
            errors.add("timestamp is required");
        } else {
            validateTimestamp(command.getTimestamp(), errors);
        }

        validateMeasure("Distance", command.getDistance(), limits.getMaxDistance(), "m", errors);
        validateMeasure("Calories", command.getCalories(), limits.getMaxCalories(), "", errors);
        validateSteps(command.getSteps(), errors);
        validateMeasure("Duration", command.getDuration(), limits.getMaxDuration(), "s", errors);

        return new ValidationResult(errors);
    }

    public int getMaxIdentifierLength() {
        return limits.getMaxIdentifierLength();
    }

    private void validateTimestamp(Object raw, List<String> errors) {
        Instant timestamp;
        try {
            timestamp = TimestampNormalizer.normalize(raw);
        } catch (IllegalArgumentException e) {
            errors.add("Invalid timestamp format: " + e.getMessage());
            return;
        }

        Instant now = clock.instant();
        Duration ahead = Duration.between(now, timestamp);
        if (ahead.compareTo(limits.getMaxFutureOffset()) > 0) {
            errors.add(String.format("Timestamp is too far in the future: %ds ahead (max: %ds)",
                    ahead.getSeconds(), limits.getMaxFutureOffset().getSeconds()));
        }

        Duration ago = Duration.between(timestamp, now);
        if (ago.compareTo(limits.getMaxPastOffset()) > 0) {
            errors.add(String.format("Timestamp is too far in the past: %ds ago (max: %ds)",
                    ago.getSeconds(), limits.getMaxPastOffset().getSeconds()));
        }
    }

    private void validateSteps(BigDecimal steps, List<String> errors) {
        if (steps == null) {
            return;
        }
        if (steps.signum() < 0) {
            errors.add("Steps cannot be negative");
        } else if (steps.stripTrailingZeros().scale() > 0) {
            errors.add("Steps must be an integer");
        } else if (steps.compareTo(limits.getMaxSteps()) > 0) {
            errors.add(String.format("Steps exceeds maximum: %s (max: %s)",
                    steps.toPlainString(), limits.getMaxSteps().toPlainString()));
        }
    }

    private static void validateMeasure(String name, BigDecimal value, BigDecimal max, String unit, List<String> errors) {
        if (value == null) {
            return;
        }
        if (value.signum() < 0) {
            errors.add(name + " cannot be negative");
        } else if (value.compareTo(max) > 0) {
            errors.add(String.format("%s exceeds maximum: %s%s (max: %s%s)",
                    name, value.toPlainString(), unit, max.toPlainString(), unit));
        }
    }

    private void requireIdentifier(String value, String field, List<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add(field + " is required");
        } else if (value.length() > limits.getMaxIdentifierLength()) {
            errors.add(String.format("%s exceeds maximum length: %d (max: %d)",
                    field, value.length(), limits.getMaxIdentifierLength()));
        }
    }
}
