package com.koni.sessions.infrastructure.web.controller;

import com.koni.sessions.application.command.IngestSessionEventCommand;
import com.koni.sessions.application.command.IngestSessionEventCommandHandler;
import com.koni.sessions.application.command.IngestSessionEventResponse;
import com.koni.sessions.application.command.IngestSessionEventResult;
import com.koni.sessions.infrastructure.web.dto.SessionEventRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for exercise session event ingestion.
 * This controller handles the command side (write path).
 *
 * Endpoints:
 * - POST /api/v1/sessions/events: Accept one event of an exercise session
 *
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class SessionEventController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final IngestSessionEventCommandHandler commandHandler;

    /**
     * Accepts one exercise session event via HTTP POST.
     *
     * Example request:
     * POST /api/v1/sessions/events
     * Idempotency-Key: 3f1c2a4e
     * {
     *   "eventId": "evt-1",
     *   "sessionId": "session-1",
     *   "userId": "user-1",
     *   "timestamp": "2025-01-31T13:00:00Z",
     *   "duration": 60,
     *   "distance": 150.5,
     *   "calories": 12,
     *   "steps": 180
     * }
     *
     * @param idempotencyKey the Idempotency-Key header, optional when the body carries a key or an eventId
     * @param request the event data
     * @return 200 OK with the session aggregates, 409 Conflict while the same key is being processed,
     *         or 500 when a cached failure is replayed
     */
    @PostMapping("/v1/sessions/events")
    public ResponseEntity<IngestSessionEventResponse> ingestEvent(
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestBody SessionEventRequest request) {
        log.info("Received session event: sessionId={}, eventId={}, timestamp={}",
                request.getSessionId(), request.getEventId(), request.getTimestamp());

        IngestSessionEventCommand command = new IngestSessionEventCommand(
                idempotencyKey,
                request.getIdempotencyKey(),
                request.getEventId(),
                request.getSessionId(),
                request.getUserId(),
                request.getTimestamp(),
                request.getDuration(),
                request.getDistance(),
                request.getCalories(),
                request.getSteps(),
                request.getSequenceNumber()
        );

        IngestSessionEventResult result = commandHandler.handle(command);

        if (result.getOutcome() == IngestSessionEventResult.Outcome.IN_FLIGHT) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(IngestSessionEventResponse.failure("Request with this idempotency key is already being processed"));
        }

        IngestSessionEventResponse response = result.getResponse();
        if (!response.isSuccess()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
