package com.koni.sessions.support;

import com.koni.sessions.domain.model.SessionEvent;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Test fixtures for session events.
 */
public final class SessionEvents {

    public static final Instant BASE = Instant.parse("2025-01-31T13:00:00Z");

    private SessionEvents() {
    }

    public static SessionEvent event(String eventId, Instant timestamp, long duration, long distance) {
        return event(eventId, timestamp, duration, distance, 0, 0);
    }

    public static SessionEvent event(String eventId, Instant timestamp, long duration, long distance,
                                     long calories, long steps) {
        return SessionEvent.ingested(eventId, timestamp, BigDecimal.valueOf(duration), BigDecimal.valueOf(distance),
                BigDecimal.valueOf(calories), steps, null, BASE);
    }

    public static SessionEvent atMinute(String eventId, int minute, long distance) {
        return event(eventId, BASE.plusSeconds(minute * 60L), 60, distance);
    }
}
