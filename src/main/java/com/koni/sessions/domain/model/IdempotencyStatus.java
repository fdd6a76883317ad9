package com.koni.sessions.domain.model;

/**
 * Lifecycle state of a logical client request tracked by the idempotency ledger.
 */
public enum IdempotencyStatus {

    /**
     * The request started but its outcome is not durable yet.
     */
    PROCESSING,

    /**
     * The request succeeded and its response is cached.
     */
    COMPLETED,

    /**
     * The request failed and an error summary is cached.
     */
    FAILED
}
