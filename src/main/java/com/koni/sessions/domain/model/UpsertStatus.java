package com.koni.sessions.domain.model;

/**
 * Outcome of a transactional event upsert.
 */
public enum UpsertStatus {
    CREATED,
    DUPLICATE
}
