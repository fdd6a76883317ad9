package com.koni.sessions.domain.repository;

import com.koni.sessions.domain.model.SessionEvent;

import java.util.List;

/**
 * Repository interface for the per-session event store.
 * The store serves both as the duplicate detection set and as the source of truth
 * for aggregate recomputation.
 * 
 * Events are write-once: there is no update or delete operation.
 */
public interface SessionEventRepository {

    /**
     * Checks if an event with the given identifier is already stored for the session.
     * 
     * @param sessionId the unique identifier of the session
     * @param eventId the client supplied event identifier
     * @return true if the event exists, false otherwise
     * @throws IllegalArgumentException if sessionId or eventId is null
     */
    boolean exists(String sessionId, String eventId);

    /**
     * Retrieves every event stored for the session, in no particular order.
     * 
     * @param sessionId the unique identifier of the session
     * @return all events of the session, or an empty list if none exist
     */
    List<SessionEvent> findAllBySessionId(String sessionId);

    /**
     * Inserts a new event under the session.
     * 
     * @param sessionId the unique identifier of the session
     * @param event the event to store
     * @throws com.koni.sessions.domain.exception.SessionWriteConflictException if the
     *         same event was inserted by a concurrent transaction
     */
    void insert(String sessionId, SessionEvent event);
}
