package com.koni.sessions.infrastructure.persistence.repository;

import com.koni.sessions.domain.exception.SessionWriteConflictException;
import com.koni.sessions.domain.model.SessionEvent;
import com.koni.sessions.domain.repository.SessionEventRepository;
import com.koni.sessions.infrastructure.persistence.entity.SessionEventEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * JPA adapter for SessionEventRepository that adapts the domain interface
 * to the JPA infrastructure layer.
 *
 * It handles mapping between domain models (SessionEvent) and JPA entities (SessionEventEntity).
 */
@Component
@RequiredArgsConstructor
public class JpaSessionEventRepositoryAdapter implements SessionEventRepository {

    private final SessionEventJpaRepository jpaRepository;

    /**
     * Checks if an event was already stored for the given session.
     *
     * @param sessionId the session identifier
     * @param eventId the event identifier
     * @return true if the event exists, false otherwise
     * @throws IllegalArgumentException if sessionId or eventId is null
     */
    @Override
    public boolean exists(String sessionId, String eventId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("SessionId cannot be null");
        }
        if (eventId == null) {
            throw new IllegalArgumentException("EventId cannot be null");
        }

        return jpaRepository.existsBySessionIdAndEventId(sessionId, eventId);
    }

    @Override
    public List<SessionEvent> findAllBySessionId(String sessionId) {
        return jpaRepository.findAllBySessionId(sessionId).stream()
            .map(this::toDomain)
            .collect(Collectors.toList());
    }

    /**
     * Inserts an event and flushes it, so a concurrent insert of the same event
     * fails on the primary key inside the current attempt.
     *
     * @throws SessionWriteConflictException if the event was stored concurrently
     * @throws DataIntegrityViolationException if the row breaks any other constraint
     */
    @Override
    public void insert(String sessionId, SessionEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("SessionEvent cannot be null");
        }

        try {
            jpaRepository.saveAndFlush(toEntity(sessionId, event));
        } catch (DataIntegrityViolationException e) {
            if (!DuplicateKeyViolations.isDuplicateKey(e)) {
                throw e;
            }
            throw new SessionWriteConflictException(
                "Event " + event.getEventId() + " was stored concurrently in session " + sessionId, e);
        }
    }

    private SessionEvent toDomain(SessionEventEntity entity) {
        return new SessionEvent(
            entity.getEventId(),
            entity.getTimestamp(),
            entity.getDuration(),
            entity.getDistance(),
            entity.getCalories(),
            entity.getSteps(),
            entity.getSequenceNumber(),
            entity.getIngestedAt(),
            entity.getVersion()
        );
    }

    private SessionEventEntity toEntity(String sessionId, SessionEvent event) {
        return new SessionEventEntity(
            sessionId,
            event.getEventId(),
            event.getTimestamp(),
            event.getDuration(),
            event.getDistance(),
            event.getCalories(),
            event.getSteps(),
            event.getSequenceNumber(),
            event.getIngestedAt(),
            event.getVersion()
        );
    }
}
