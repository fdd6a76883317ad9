package com.koni.sessions.application.service;

import com.koni.sessions.application.port.IngestionObserver;
import com.koni.sessions.domain.model.ExerciseSession;
import com.koni.sessions.domain.model.OrderValidationResult;
import com.koni.sessions.domain.model.SessionAggregates;
import com.koni.sessions.domain.model.SessionEvent;
import com.koni.sessions.domain.model.UpsertResult;
import com.koni.sessions.domain.repository.SessionEventRepository;
import com.koni.sessions.domain.repository.SessionRepository;
import com.koni.sessions.domain.service.EventOrderAdvisor;
import com.koni.sessions.domain.service.SessionAggregateCalculator;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static com.koni.sessions.application.port.IngestionMetricNames.TAG_ATTEMPT;
import static com.koni.sessions.application.port.IngestionMetricNames.TRANSACTION_RETRY;

/**
 * Coordinates the atomic unit of work behind every event write.
 *
 * One attempt runs in a single store transaction:
 * 1. Duplicate check on the event id; a known event returns the current aggregates untouched
 * 2. Read the session (may be absent) and every stored event of the session
 * 3. Insert the new event
 * 4. Recompute the aggregates over all events, including the new one
 * 5. Create the session at version 1, or update it carrying version + 1
 *
 * Attempts that lose against a concurrent writer of the same session are rolled back and
 * run again by the {@link TransactionRetryPolicy}. The session is guarded by the store's
 * transactions and the version check only; there is no application lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionUpsertCoordinator {

    private final SessionRepository sessionRepository;
    private final SessionEventRepository eventRepository;
    private final TransactionOperations transactionOperations;
    private final TransactionRetryPolicy retryPolicy;
    private final IngestionObserver observer;
    private final Clock clock;

    /**
     * Writes an event and refreshes the aggregates of its session, at most once per event id.
     *
     * @param sessionId the session the event belongs to
     * @param userId the owner used when the session has to be created
     * @param event the normalized event
     * @return CREATED with the recomputed aggregates, or DUPLICATE with the current ones
     */
    @Observed(name = "session.upsert", contextualName = "upsert-session-event")
    public UpsertResult upsert(String sessionId, String userId, SessionEvent event) {
        AtomicInteger attempts = new AtomicInteger();

        return retryPolicy.execute(() -> {
            int attempt = attempts.incrementAndGet();
            if (attempt > 1) {
                observer.recordCounter(TRANSACTION_RETRY, Map.of(TAG_ATTEMPT, String.valueOf(attempt)));
            }
            return transactionOperations.execute(status -> upsertInTransaction(sessionId, userId, event));
        });
    }

    private UpsertResult upsertInTransaction(String sessionId, String userId, SessionEvent event) {
        if (eventRepository.exists(sessionId, event.getEventId())) {
            log.info("Duplicate event detected: sessionId={}, eventId={}. Skipping write.",
                    sessionId, event.getEventId());
            SessionAggregates current = sessionRepository.findBySessionId(sessionId)
                    .map(ExerciseSession::toAggregates)
                    .orElse(null);
            return UpsertResult.duplicate(current);
        }

        Optional<ExerciseSession> existingSession = sessionRepository.findBySessionId(sessionId);
        List<SessionEvent> existingEvents = eventRepository.findAllBySessionId(sessionId);
        OrderValidationResult order = EventOrderAdvisor.validateEventOrder(existingEvents, event);

        eventRepository.insert(sessionId, event);

        List<SessionEvent> allEvents = new ArrayList<>(existingEvents);
        allEvents.add(event);
        SessionAggregates aggregates = SessionAggregateCalculator.computeAggregates(allEvents);

        Instant now = clock.instant();
        if (existingSession.isPresent()) {
            sessionRepository.updateAggregates(sessionId, aggregates, existingSession.get().getVersion(), now);
        } else {
            sessionRepository.create(ExerciseSession.create(sessionId, userId, aggregates, now));
        }

        log.debug("Event stored and session recomputed: sessionId={}, eventId={}, eventCount={}",
                sessionId, event.getEventId(), aggregates.getEventCount());

        return UpsertResult.created(aggregates, order);
    }
}
