package com.koni.sessions.application.validation;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Converts the timestamp representations clients send into an {@link Instant}.
 * Numbers are epoch milliseconds; strings are ISO-8601 instants or offset date-times.
 */
public final class TimestampNormalizer {

    private TimestampNormalizer() {
    }

    /**
     * @param raw the timestamp as received
     * @return the parsed instant
     * @throws IllegalArgumentException if the value cannot be interpreted as a point in time
     */
    public static Instant normalize(Object raw) {
        if (raw instanceof Instant) {
            return (Instant) raw;
        }
        if (raw instanceof Number) {
            return Instant.ofEpochMilli(((Number) raw).longValue());
        }
        if (raw instanceof String) {
            return parse((String) raw);
        }
        throw new IllegalArgumentException("Unsupported timestamp type: "
                + (raw == null ? "null" : raw.getClass().getSimpleName()));
    }

    private static Instant parse(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException nested) {
                throw new IllegalArgumentException("Invalid timestamp string: " + value, nested);
            }
        }
    }
}
