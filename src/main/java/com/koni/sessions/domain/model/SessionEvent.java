package com.koni.sessions.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * SessionEvent value object representing one measurement interval of an exercise session.
 * Events are write-once: after the first successful write their measures never change.
 * The eventId is unique within a session and doubles as the natural idempotency anchor.
 *
 * Measures are held at {@link #MEASURE_SCALE} decimal places, the precision the store keeps,
 * so aggregates computed in memory equal the ones read back later.
 */
@Getter
@EqualsAndHashCode(of = "eventId")
public class SessionEvent {

    public static final int MEASURE_SCALE = 4;

    private final String eventId;
    private final Instant timestamp;
    private final BigDecimal duration;
    private final BigDecimal distance;
    private final BigDecimal calories;
    private final long steps;

    /**
     * Client ordering hint. Advisory only, never used for aggregation.
     */
    private final Long sequenceNumber;

    private final Instant ingestedAt;
    private final int version;

    public SessionEvent(String eventId, Instant timestamp, BigDecimal duration, BigDecimal distance,
                        BigDecimal calories, long steps, Long sequenceNumber, Instant ingestedAt, int version) {
        this.eventId = eventId;
        this.timestamp = timestamp;
        this.duration = toMeasureScale(duration);
        this.distance = toMeasureScale(distance);
        this.calories = toMeasureScale(calories);
        this.steps = steps;
        this.sequenceNumber = sequenceNumber;
        this.ingestedAt = ingestedAt;
        this.version = version;
    }

    /**
     * Creates a first-version event as it is ingested.
     *
     * @param eventId the client supplied event identifier
     * @param timestamp the client supplied event time
     * @param duration interval duration in seconds
     * @param distance distance in meters
     * @param calories calories burned
     * @param steps step count
     * @param sequenceNumber optional client ordering hint
     * @param ingestedAt server time of the write
     * @return the new event with version 1
     */
    public static SessionEvent ingested(String eventId, Instant timestamp, BigDecimal duration,
                                        BigDecimal distance, BigDecimal calories, long steps,
                                        Long sequenceNumber, Instant ingestedAt) {
        return new SessionEvent(eventId, timestamp, duration, distance, calories, steps,
                sequenceNumber, ingestedAt, 1);
    }

    private static BigDecimal toMeasureScale(BigDecimal measure) {
        return measure == null ? null : measure.setScale(MEASURE_SCALE, RoundingMode.HALF_UP);
    }

    @Override
    public String toString() {
        return "SessionEvent{" +
                "eventId='" + eventId + '\'' +
                ", timestamp=" + timestamp +
                ", duration=" + duration +
                ", distance=" + distance +
                ", calories=" + calories +
                ", steps=" + steps +
                ", sequenceNumber=" + sequenceNumber +
                ", version=" + version +
                '}';
    }
}
