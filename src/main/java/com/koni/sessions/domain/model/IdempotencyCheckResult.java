package com.koni.sessions.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of looking up an idempotency key in the ledger.
 * A missing or expired record is the normal NOVEL case, not an error.
 */
@Getter
@AllArgsConstructor
@ToString
public class IdempotencyCheckResult {

    public enum Outcome {
        /**
         * No live record: the request must be processed.
         */
        NOVEL,

        /**
         * The request already reached COMPLETED or FAILED; its cached response must be replayed.
         */
        DUPLICATE_WITH_CACHED_RESPONSE,

        /**
         * The request is still PROCESSING elsewhere; no response is available yet.
         */
        DUPLICATE_IN_FLIGHT
    }

    private final Outcome outcome;

    /**
     * Status of the record that produced a duplicate outcome, null when NOVEL.
     */
    private final IdempotencyStatus status;

    /**
     * Cached response JSON, only present for DUPLICATE_WITH_CACHED_RESPONSE.
     */
    private final String cachedResponse;

    public static IdempotencyCheckResult novel() {
        return new IdempotencyCheckResult(Outcome.NOVEL, null, null);
    }

    public static IdempotencyCheckResult inFlight() {
        return new IdempotencyCheckResult(Outcome.DUPLICATE_IN_FLIGHT, IdempotencyStatus.PROCESSING, null);
    }

    public static IdempotencyCheckResult cached(IdempotencyStatus status, String response) {
        return new IdempotencyCheckResult(Outcome.DUPLICATE_WITH_CACHED_RESPONSE, status, response);
    }

    public boolean isDuplicate() {
        return outcome != Outcome.NOVEL;
    }
}
