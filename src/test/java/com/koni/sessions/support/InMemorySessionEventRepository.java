package com.koni.sessions.support;

import com.koni.sessions.domain.exception.SessionWriteConflictException;
import com.koni.sessions.domain.model.SessionEvent;
import com.koni.sessions.domain.repository.SessionEventRepository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Map backed SessionEventRepository. Events are write-once per session and event id.
 * A number of upcoming inserts can be forced to conflict, or to fail with a given exception,
 * before anything is written.
 */
public class InMemorySessionEventRepository implements SessionEventRepository {

    private final Map<String, Map<String, SessionEvent>> events = new LinkedHashMap<>();
    private int forcedConflicts;
    private RuntimeException forcedFailure;
    private int insertAttempts;

    public void failNextInserts(int count) {
        this.forcedConflicts = count;
    }

    public void failNextInsertWith(RuntimeException failure) {
        this.forcedFailure = failure;
    }

    public int getInsertAttempts() {
        return insertAttempts;
    }

    @Override
    public boolean exists(String sessionId, String eventId) {
        return events.getOrDefault(sessionId, Map.of()).containsKey(eventId);
    }

    @Override
    public List<SessionEvent> findAllBySessionId(String sessionId) {
        return new ArrayList<>(events.getOrDefault(sessionId, Map.of()).values());
    }

    @Override
    public void insert(String sessionId, SessionEvent event) {
        insertAttempts++;
        if (forcedFailure != null) {
            RuntimeException failure = forcedFailure;
            forcedFailure = null;
            throw failure;
        }
        if (forcedConflicts > 0) {
            forcedConflicts--;
            throw new SessionWriteConflictException("Forced conflict on session " + sessionId);
        }
        Map<String, SessionEvent> session = events.computeIfAbsent(sessionId, id -> new LinkedHashMap<>());
        if (session.putIfAbsent(event.getEventId(), event) != null) {
            throw new SessionWriteConflictException("Event " + event.getEventId() + " already stored");
        }
    }

    public int count(String sessionId) {
        return events.getOrDefault(sessionId, Map.of()).size();
    }
}
