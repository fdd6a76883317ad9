package com.koni.sessions.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Command to ingest one exercise session event as received from a client.
 * Nothing in it is validated yet; the handler validates and normalizes it.
 */
@Getter
@AllArgsConstructor
public class IngestSessionEventCommand {

    /**
     * Idempotency key sent as a request header, preferred over the body key.
     */
    private final String idempotencyKeyHeader;

    /**
     * Idempotency key sent in the body.
     */
    private final String idempotencyKey;

    private final String eventId;
    private final String sessionId;
    private final String userId;

    /**
     * Event time as an ISO-8601 string, epoch milliseconds or an Instant.
     */
    private final Object timestamp;

    private final BigDecimal duration;
    private final BigDecimal distance;
    private final BigDecimal calories;
    private final BigDecimal steps;
    private final Long sequenceNumber;

    /**
     * Resolves the idempotency key: header first, then body key, then the event id.
     *
     * @return the key, or null when the request carries none
     */
    public String resolveIdempotencyKey() {
        if (isPresent(idempotencyKeyHeader)) {
            return idempotencyKeyHeader;
        }
        if (isPresent(idempotencyKey)) {
            return idempotencyKey;
        }
        return isPresent(eventId) ? eventId : null;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
