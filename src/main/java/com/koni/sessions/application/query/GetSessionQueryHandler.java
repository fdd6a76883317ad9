package com.koni.sessions.application.query;

import com.koni.sessions.domain.exception.SessionNotFoundException;
import com.koni.sessions.domain.model.ExerciseSession;
import com.koni.sessions.domain.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Query handler for reading a single exercise session.
 * This is the read side next to the ingest command; it never writes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetSessionQueryHandler {

    private final SessionRepository repository;

    /**
     * Handles the GetSessionQuery by loading the session and mapping it to a SessionResponse.
     *
     * @param query the query carrying the session id
     * @return the session with its current aggregates
     * @throws SessionNotFoundException if no event was ever stored for the session
     */
    @Transactional(readOnly = true)
    public SessionResponse handle(GetSessionQuery query) {
        log.debug("Handling GetSessionQuery: sessionId={}", query.getSessionId());

        return repository.findBySessionId(query.getSessionId())
                .map(GetSessionQueryHandler::toResponse)
                .orElseThrow(() -> new SessionNotFoundException(query.getSessionId()));
    }

    private static SessionResponse toResponse(ExerciseSession session) {
        return new SessionResponse(
                session.getSessionId(),
                session.getUserId(),
                session.getStartTime(),
                session.getEndTime(),
                session.getTotalDuration(),
                session.getTotalDistance(),
                session.getTotalCalories(),
                session.getTotalSteps(),
                session.getEventCount(),
                session.getLastEventTime(),
                session.getVersion(),
                session.getCreatedAt(),
                session.getUpdatedAt()
        );
    }
}
