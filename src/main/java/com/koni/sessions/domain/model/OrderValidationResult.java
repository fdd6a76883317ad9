package com.koni.sessions.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Diagnostic classification of an incoming event relative to the events already stored.
 * Sequences are 1-based positions in timestamp order and are absent when the session
 * had no events yet.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class OrderValidationResult {

    private final boolean outOfOrder;
    private final Integer expectedSequence;
    private final Integer actualSequence;

    public static OrderValidationResult inOrder() {
        return new OrderValidationResult(false, null, null);
    }
}
