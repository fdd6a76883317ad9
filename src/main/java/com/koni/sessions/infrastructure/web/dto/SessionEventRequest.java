package com.koni.sessions.infrastructure.web.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Data Transfer Object for an incoming exercise session event via REST API.
 *
 * Contains:
 * - eventId, sessionId, userId: identifiers of the event, its session and the owning user
 * - timestamp: ISO 8601 string or epoch milliseconds
 * - duration (seconds), distance (meters), calories, steps: optional measures, 0 when absent
 * - sequenceNumber: optional client-side ordinal, informational only
 * - idempotencyKey: optional fallback when no Idempotency-Key header is sent
 *
 * Field rules are checked by the application's validator so that every violation
 * is reported at once.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SessionEventRequest {

    private String eventId;
    private String sessionId;
    private String userId;
    private Object timestamp;
    private BigDecimal duration;
    private BigDecimal distance;
    private BigDecimal calories;
    private BigDecimal steps;
    private Long sequenceNumber;
    private String idempotencyKey;
}
