package com.koni.sessions.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * ExerciseSession snapshot holding the running aggregates of one session.
 * The totals always reflect exactly the events stored for the session; they are
 * rewritten from a full recomputation on every successful event write.
 *
 * The version is an optimistic concurrency counter: 1 on creation, incremented
 * on every successful update.
 */
@Getter
@AllArgsConstructor
public class ExerciseSession {

    private final String sessionId;
    private final String userId;
    private final Instant startTime;
    private final Instant endTime;
    private final BigDecimal totalDuration;
    private final BigDecimal totalDistance;
    private final BigDecimal totalCalories;
    private final long totalSteps;
    private final int eventCount;
    private final Instant lastEventTime;
    private final long version;
    private final Instant createdAt;
    private final Instant updatedAt;

    /**
     * Creates a brand new session from its first computed aggregates.
     *
     * @param sessionId the session identifier
     * @param userId the owning user, immutable afterwards
     * @param aggregates the aggregates computed over the first event
     * @param now creation time, used for both createdAt and updatedAt
     * @return a session at version 1
     */
    public static ExerciseSession create(String sessionId, String userId, SessionAggregates aggregates, Instant now) {
        return new ExerciseSession(
                sessionId,
                userId,
                aggregates.getStartTime(),
                aggregates.getEndTime(),
                aggregates.getTotalDuration(),
                aggregates.getTotalDistance(),
                aggregates.getTotalCalories(),
                aggregates.getTotalSteps(),
                aggregates.getEventCount(),
                aggregates.getLastEventTime(),
                1L,
                now,
                now
        );
    }

    /**
     * Returns the current aggregates of this session.
     * A session persisted without an end time reports its start time instead.
     *
     * @return the aggregates view of this session
     */
    public SessionAggregates toAggregates() {
        return new SessionAggregates(
                startTime,
                endTime != null ? endTime : startTime,
                totalDuration,
                totalDistance,
                totalCalories,
                totalSteps,
                eventCount,
                lastEventTime
        );
    }

    @Override
    public String toString() {
        return "ExerciseSession{" +
                "sessionId='" + sessionId + '\'' +
                ", userId='" + userId + '\'' +
                ", eventCount=" + eventCount +
                ", totalDistance=" + totalDistance +
                ", version=" + version +
                '}';
    }
}
