package com.koni.sessions.application.command;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.koni.sessions.domain.model.SessionAggregates;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Response of an ingest request. This is also the payload cached by the idempotency
 * ledger and replayed verbatim to retries of the same request.
 *
 * Example success:
 * {
 *   "success": true,
 *   "session": {
 *     "sessionId": "session-1",
 *     "aggregates": {
 *       "totalDuration": 60,
 *       "totalDistance": 600,
 *       "totalCalories": 60,
 *       "totalSteps": 600,
 *       "eventCount": 3
 *     }
 *   }
 * }
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestSessionEventResponse {

    private boolean success;
    private SessionSummary session;
    private String error;

    public static IngestSessionEventResponse success(String sessionId, SessionAggregates aggregates) {
        SessionSummary summary = aggregates == null ? null : new SessionSummary(sessionId, new Aggregates(
                aggregates.getTotalDuration(),
                aggregates.getTotalDistance(),
                aggregates.getTotalCalories(),
                aggregates.getTotalSteps(),
                aggregates.getEventCount()
        ));
        return new IngestSessionEventResponse(true, summary, null);
    }

    public static IngestSessionEventResponse failure(String error) {
        return new IngestSessionEventResponse(false, null, error);
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SessionSummary {

        private String sessionId;
        private Aggregates aggregates;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Aggregates {

        private BigDecimal totalDuration;
        private BigDecimal totalDistance;
        private BigDecimal totalCalories;
        private long totalSteps;
        private int eventCount;
    }
}
