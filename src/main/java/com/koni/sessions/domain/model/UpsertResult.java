package com.koni.sessions.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of a transactional event upsert.
 * Aggregates are null only for a duplicate event whose session record is missing.
 * The order validation is only present for created events.
 */
@Getter
@AllArgsConstructor
@ToString
public class UpsertResult {

    private final UpsertStatus status;
    private final SessionAggregates aggregates;
    private final OrderValidationResult orderValidation;

    public static UpsertResult created(SessionAggregates aggregates, OrderValidationResult orderValidation) {
        return new UpsertResult(UpsertStatus.CREATED, aggregates, orderValidation);
    }

    public static UpsertResult duplicate(SessionAggregates aggregates) {
        return new UpsertResult(UpsertStatus.DUPLICATE, aggregates, null);
    }

    public boolean isDuplicate() {
        return status == UpsertStatus.DUPLICATE;
    }
}
