package com.koni.sessions.application.validation;

import com.koni.sessions.domain.model.SessionEvent;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A validated event payload with its timestamp parsed and absent measures set to zero.
 */
@Getter
@AllArgsConstructor
@ToString
public class NormalizedSessionEvent {

    private final String eventId;
    private final String sessionId;
    private final String userId;
    private final Instant timestamp;
    private final BigDecimal duration;
    private final BigDecimal distance;
    private final BigDecimal calories;
    private final long steps;
    private final Long sequenceNumber;

    /**
     * Builds the event to store, stamped with the server ingestion time.
     *
     * @param ingestedAt the server time of the write
     * @return a version 1 event
     */
    public SessionEvent toSessionEvent(Instant ingestedAt) {
        return SessionEvent.ingested(eventId, timestamp, duration, distance, calories, steps,
                sequenceNumber, ingestedAt);
    }
}
