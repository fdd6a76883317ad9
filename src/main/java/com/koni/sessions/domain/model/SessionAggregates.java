package com.koni.sessions.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Session level summary statistics derived from the full set of a session's events.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class SessionAggregates {

    private final Instant startTime;
    private final Instant endTime;
    private final BigDecimal totalDuration;
    private final BigDecimal totalDistance;
    private final BigDecimal totalCalories;
    private final long totalSteps;
    private final int eventCount;
    private final Instant lastEventTime;
}
