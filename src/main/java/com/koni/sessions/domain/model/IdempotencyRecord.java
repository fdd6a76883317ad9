package com.koni.sessions.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * IdempotencyRecord tracks the outcome of one logical client request, keyed by the
 * client supplied idempotency key. The cached response is opaque JSON text.
 */
@Getter
@AllArgsConstructor
@ToString
public class IdempotencyRecord {

    private final String idempotencyKey;
    private final String sessionId;
    private final IdempotencyStatus status;
    private final String response;
    private final Instant createdAt;
    private final Instant expiresAt;

    /**
     * Checks whether this record is past its expiry at the given instant.
     *
     * @param now the current time
     * @return true if the record must be treated as absent
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt.isBefore(now);
    }
}
