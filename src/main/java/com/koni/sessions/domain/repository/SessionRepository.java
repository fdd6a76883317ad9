package com.koni.sessions.domain.repository;

import com.koni.sessions.domain.model.ExerciseSession;
import com.koni.sessions.domain.model.SessionAggregates;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for ExerciseSession persistence operations.
 * This interface is part of the domain layer and defines the contract
 * for session data access without coupling to specific infrastructure implementations.
 * 
 * Writes are only issued from inside the upsert transaction. Both write methods
 * detect concurrent writers and report them as
 * {@link com.koni.sessions.domain.exception.SessionWriteConflictException}.
 */
public interface SessionRepository {

    /**
     * Finds a session by its identifier.
     * 
     * @param sessionId the unique identifier of the session
     * @return an Optional containing the session if found, or empty if not found
     * @throws IllegalArgumentException if sessionId is null
     */
    Optional<ExerciseSession> findBySessionId(String sessionId);

    /**
     * Inserts a new session record.
     * 
     * @param session the session to create, expected at version 1
     * @throws com.koni.sessions.domain.exception.SessionWriteConflictException if another
     *         transaction created the same session concurrently
     */
    void create(ExerciseSession session);

    /**
     * Overwrites the aggregates of an existing session and increments its version,
     * provided the stored version still equals the expected one.
     * 
     * @param sessionId the unique identifier of the session
     * @param aggregates the freshly recomputed aggregates
     * @param expectedVersion the version read at the start of the transaction
     * @param updatedAt the update time
     * @throws com.koni.sessions.domain.exception.SessionWriteConflictException if the
     *         stored version no longer matches
     */
    void updateAggregates(String sessionId, SessionAggregates aggregates, long expectedVersion, Instant updatedAt);
}
