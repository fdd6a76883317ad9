package com.koni.sessions.infrastructure.persistence.repository;

import com.koni.sessions.infrastructure.persistence.entity.SessionEventEntity;
import com.koni.sessions.infrastructure.persistence.entity.SessionEventKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * JPA repository for SessionEventEntity persistence operations.
 *
 * The primary key on (session_id, event_id) guarantees that an event
 * cannot be stored twice under the same session.
 */
@Repository
public interface SessionEventJpaRepository extends JpaRepository<SessionEventEntity, SessionEventKey> {

    /**
     * Checks if an event with the given id was already stored for the session.
     * Used by the upsert to detect duplicates before writing.
     *
     * @param sessionId the session identifier
     * @param eventId the event identifier
     * @return true if the event exists, false otherwise
     */
    boolean existsBySessionIdAndEventId(String sessionId, String eventId);

    List<SessionEventEntity> findAllBySessionId(String sessionId);
}
