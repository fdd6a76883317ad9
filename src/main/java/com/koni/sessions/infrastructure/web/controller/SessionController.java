package com.koni.sessions.infrastructure.web.controller;

import com.koni.sessions.application.query.GetSessionQuery;
import com.koni.sessions.application.query.GetSessionQueryHandler;
import com.koni.sessions.application.query.SessionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for session queries.
 * This controller handles the query side (read path).
 *
 * Endpoints:
 * - GET /api/v1/sessions/{sessionId}: Retrieve one session with its aggregates
 *
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final GetSessionQueryHandler queryHandler;

    /**
     * Retrieves a session with its current aggregates.
     *
     * @param sessionId the session identifier
     * @return 200 OK with the session, 404 Not Found if the session does not exist
     */
    @GetMapping("/v1/sessions/{sessionId}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String sessionId) {
        log.info("Received request to get session: sessionId={}", sessionId);

        SessionResponse session = queryHandler.handle(new GetSessionQuery(sessionId));

        return ResponseEntity.ok(session);
    }
}
