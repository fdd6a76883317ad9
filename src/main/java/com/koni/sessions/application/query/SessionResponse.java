package com.koni.sessions.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read model of an exercise session as returned to clients.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

    private String sessionId;
    private String userId;
    private Instant startTime;
    private Instant endTime;
    private BigDecimal totalDuration;
    private BigDecimal totalDistance;
    private BigDecimal totalCalories;
    private long totalSteps;
    private int eventCount;
    private Instant lastEventTime;
    private long version;
    private Instant createdAt;
    private Instant updatedAt;
}
