package com.koni.sessions.infrastructure.persistence.repository;

import com.koni.sessions.domain.exception.SessionWriteConflictException;
import com.koni.sessions.domain.model.ExerciseSession;
import com.koni.sessions.domain.model.SessionAggregates;
import com.koni.sessions.domain.repository.SessionRepository;
import com.koni.sessions.infrastructure.persistence.entity.SessionEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * JPA adapter for SessionRepository that adapts the domain interface
 * to the JPA infrastructure layer.
 *
 * This adapter follows Hexagonal Architecture principles by implementing
 * the domain repository interface and delegating to the JPA repository.
 * Lost races against concurrent writers are reported as {@link SessionWriteConflictException}.
 */
@Component
@RequiredArgsConstructor
public class JpaSessionRepositoryAdapter implements SessionRepository {

    private final SessionJpaRepository jpaRepository;

    /**
     * Finds a session by its identifier.
     *
     * @param sessionId the session identifier
     * @return an Optional containing the session if found, or empty if not found
     * @throws IllegalArgumentException if sessionId is null
     */
    @Override
    public Optional<ExerciseSession> findBySessionId(String sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("SessionId cannot be null");
        }

        return jpaRepository.findById(sessionId)
            .map(this::toDomain);
    }

    /**
     * Inserts a new session. The insert is flushed immediately so that a concurrent
     * creation of the same session fails inside the current attempt.
     *
     * @param session the session to insert
     * @throws SessionWriteConflictException if the session already exists
     * @throws DataIntegrityViolationException if the row breaks any other constraint
     */
    @Override
    public void create(ExerciseSession session) {
        if (session == null) {
            throw new IllegalArgumentException("ExerciseSession cannot be null");
        }

        try {
            jpaRepository.saveAndFlush(toEntity(session));
        } catch (DataIntegrityViolationException e) {
            if (!DuplicateKeyViolations.isDuplicateKey(e)) {
                throw e;
            }
            throw new SessionWriteConflictException(
                "Session was created concurrently: " + session.getSessionId(), e);
        }
    }

    /**
     * Rewrites the aggregates of a session and increments its version.
     *
     * @throws SessionWriteConflictException if the stored version no longer matches
     */
    @Override
    public void updateAggregates(String sessionId, SessionAggregates aggregates, long expectedVersion, Instant updatedAt) {
        int updated = jpaRepository.updateAggregatesIfVersionMatches(
            sessionId,
            expectedVersion,
            aggregates.getStartTime(),
            aggregates.getEndTime(),
            aggregates.getTotalDuration(),
            aggregates.getTotalDistance(),
            aggregates.getTotalCalories(),
            aggregates.getTotalSteps(),
            aggregates.getEventCount(),
            aggregates.getLastEventTime(),
            updatedAt
        );

        if (updated == 0) {
            throw new SessionWriteConflictException(
                "Session " + sessionId + " is no longer at version " + expectedVersion);
        }
    }

    private ExerciseSession toDomain(SessionEntity entity) {
        return new ExerciseSession(
            entity.getSessionId(),
            entity.getUserId(),
            entity.getStartTime(),
            entity.getEndTime(),
            entity.getTotalDuration(),
            entity.getTotalDistance(),
            entity.getTotalCalories(),
            entity.getTotalSteps(),
            entity.getEventCount(),
            entity.getLastEventTime(),
            entity.getVersion(),
            entity.getCreatedAt(),
            entity.getUpdatedAt()
        );
    }

    private SessionEntity toEntity(ExerciseSession session) {
        return new SessionEntity(
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
