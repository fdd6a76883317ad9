package com.koni.sessions.application.service;

import com.koni.sessions.domain.exception.SessionWriteConflictException;
import com.koni.sessions.domain.model.ExerciseSession;
import com.koni.sessions.domain.model.SessionAggregates;
import com.koni.sessions.domain.model.SessionEvent;
import com.koni.sessions.domain.model.UpsertResult;
import com.koni.sessions.domain.model.UpsertStatus;
import com.koni.sessions.support.InMemorySessionEventRepository;
import com.koni.sessions.support.InMemorySessionRepository;
import com.koni.sessions.support.MutableClock;
import com.koni.sessions.support.RecordingIngestionObserver;
import com.koni.sessions.tags.UnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.koni.sessions.application.port.IngestionMetricNames.TRANSACTION_RETRY;
import static com.koni.sessions.support.RetryPolicies.fastRetryPolicy;
import static com.koni.sessions.support.SessionEvents.BASE;
import static com.koni.sessions.support.SessionEvents.atMinute;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for SessionUpsertCoordinator.
 * Tests aggregate maintenance, duplicate handling, versioning and conflict retries.
 */
@UnitTest
class SessionUpsertCoordinatorTest {

    private static final String SESSION = "session-1";
    private static final String USER = "user-1";
    private static final Instant NOW = Instant.parse("2025-01-31T14:00:00Z");

    private InMemorySessionRepository sessions;
    private InMemorySessionEventRepository events;
    private RecordingIngestionObserver observer;
    private MutableClock clock;
    private SessionUpsertCoordinator coordinator;

    @BeforeEach
    void setUp() {
        sessions = new InMemorySessionRepository();
        events = new InMemorySessionEventRepository();
        observer = new RecordingIngestionObserver();
        clock = new MutableClock(NOW);
        coordinator = new SessionUpsertCoordinator(sessions, events, TransactionOperations.withoutTransaction(),
                fastRetryPolicy(), observer, clock);
    }

    @Test
    void shouldCreateSessionOnFirstEvent() {
        UpsertResult result = coordinator.upsert(SESSION, USER, atMinute("a", 0, 100));

        assertThat(result.getStatus()).isEqualTo(UpsertStatus.CREATED);
        assertThat(result.getOrderValidation().isOutOfOrder()).isFalse();

        ExerciseSession session = sessions.findBySessionId(SESSION).orElseThrow();
        assertThat(session.getUserId()).isEqualTo(USER);
        assertThat(session.getVersion()).isEqualTo(1L);
        assertThat(session.getEventCount()).isEqualTo(1);
        assertThat(session.getCreatedAt()).isEqualTo(NOW);
        assertThat(session.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void shouldRecomputeAggregatesWhenEventArrivesOutOfOrder() {
        coordinator.upsert(SESSION, USER, atMinute("A", 0, 100));
        coordinator.upsert(SESSION, USER, atMinute("C", 2, 300));

        UpsertResult result = coordinator.upsert(SESSION, USER, atMinute("B", 1, 200));

        SessionAggregates aggregates = result.getAggregates();
        assertThat(aggregates.getTotalDistance()).isEqualByComparingTo("600");
        assertThat(aggregates.getEventCount()).isEqualTo(3);
        assertThat(aggregates.getStartTime()).isEqualTo(BASE);
        assertThat(aggregates.getEndTime()).isEqualTo(BASE.plusSeconds(120));
        assertThat(result.getOrderValidation().isOutOfOrder()).isTrue();
        assertThat(result.getOrderValidation().getExpectedSequence()).isEqualTo(3);
        assertThat(result.getOrderValidation().getActualSequence()).isEqualTo(2);
    }

    @Test
    void shouldConvergeToSameAggregatesForAnyArrivalOrder() {
        List<List<String>> orders = List.of(
                List.of("A", "B", "C"), List.of("A", "C", "B"), List.of("B", "A", "C"),
                List.of("B", "C", "A"), List.of("C", "A", "B"), List.of("C", "B", "A"));

        SessionAggregates expected = null;
        for (int i = 0; i < orders.size(); i++) {
            String sessionId = "session-" + i;
            UpsertResult last = null;
            for (String id : orders.get(i)) {
                last = coordinator.upsert(sessionId, USER, eventFor(id));
            }
            if (expected == null) {
                expected = last.getAggregates();
            }
            assertThat(last.getAggregates()).isEqualTo(expected);
        }
        assertThat(expected.getTotalDistance()).isEqualByComparingTo("600");
    }

    @Test
    void shouldReturnDuplicateWithoutWritingWhenEventIdIsKnown() {
        coordinator.upsert(SESSION, USER, atMinute("a", 0, 100));
        clock.advance(Duration.ofMinutes(1));

        UpsertResult result = coordinator.upsert(SESSION, USER, atMinute("a", 5, 999));

        assertThat(result.isDuplicate()).isTrue();
        assertThat(result.getOrderValidation()).isNull();
        assertThat(result.getAggregates().getTotalDistance()).isEqualByComparingTo("100");
        assertThat(result.getAggregates().getEventCount()).isEqualTo(1);
        assertThat(events.count(SESSION)).isEqualTo(1);
        assertThat(sessions.findBySessionId(SESSION).orElseThrow().getVersion()).isEqualTo(1L);
    }

    @Test
    void shouldIncrementVersionOnEveryAcceptedEvent() {
        coordinator.upsert(SESSION, USER, atMinute("a", 0, 100));
        coordinator.upsert(SESSION, USER, atMinute("b", 1, 100));
        clock.advance(Duration.ofMinutes(10));
        coordinator.upsert(SESSION, USER, atMinute("c", 2, 100));

        ExerciseSession session = sessions.findBySessionId(SESSION).orElseThrow();
        assertThat(session.getVersion()).isEqualTo(3L);
        assertThat(session.getCreatedAt()).isEqualTo(NOW);
        assertThat(session.getUpdatedAt()).isEqualTo(NOW.plus(Duration.ofMinutes(10)));
    }

    @Test
    void shouldKeepOriginalOwnerOfSession() {
        coordinator.upsert(SESSION, USER, atMinute("a", 0, 100));
        coordinator.upsert(SESSION, "someone-else", atMinute("b", 1, 100));

        assertThat(sessions.findBySessionId(SESSION).orElseThrow().getUserId()).isEqualTo(USER);
    }

    @Test
    void shouldRetryConflictsAndReportEachRetry() {
        events.failNextInserts(2);

        UpsertResult result = coordinator.upsert(SESSION, USER, atMinute("a", 0, 100));

        assertThat(result.getStatus()).isEqualTo(UpsertStatus.CREATED);
        assertThat(events.getInsertAttempts()).isEqualTo(3);
        assertThat(observer.counters(TRANSACTION_RETRY))
                .extracting(counter -> counter.getTags().get("attempt"))
                .containsExactly("2", "3");
    }

    @Test
    void shouldFailWhenConflictPersists() {
        events.failNextInserts(5);

        assertThatThrownBy(() -> coordinator.upsert(SESSION, USER, atMinute("a", 0, 100)))
                .isInstanceOf(SessionWriteConflictException.class);
        assertThat(events.getInsertAttempts()).isEqualTo(3);
        assertThat(sessions.findBySessionId(SESSION)).isEmpty();
    }

    @Test
    void shouldNotRetryStoreFailuresThatAreNotConflicts() {
        events.failNextInsertWith(new DataIntegrityViolationException("Value too long for column event_id"));

        assertThatThrownBy(() -> coordinator.upsert(SESSION, USER, atMinute("a", 0, 100)))
                .isInstanceOf(DataIntegrityViolationException.class)
                .hasMessageContaining("Value too long");
        assertThat(events.getInsertAttempts()).isEqualTo(1);
        assertThat(observer.counters(TRANSACTION_RETRY)).isEmpty();
        assertThat(sessions.findBySessionId(SESSION)).isEmpty();
    }

    @Test
    void shouldReportSameTotalsForCreatedAndDuplicateWrites() {
        SessionEvent precise = SessionEvent.ingested("a", BASE, new BigDecimal("10.00005"),
                new BigDecimal("1.23456"), new BigDecimal("0.33333"), 10L, null, NOW);

        UpsertResult created = coordinator.upsert(SESSION, USER, precise);
        UpsertResult duplicate = coordinator.upsert(SESSION, USER, precise);

        assertThat(created.getAggregates().getTotalDistance()).isEqualTo(new BigDecimal("1.2346"));
        assertThat(created.getAggregates().getTotalDuration()).isEqualTo(new BigDecimal("10.0001"));
        assertThat(duplicate.getStatus()).isEqualTo(UpsertStatus.DUPLICATE);
        assertThat(duplicate.getAggregates().getTotalDistance()).isEqualTo(created.getAggregates().getTotalDistance());
        assertThat(duplicate.getAggregates().getTotalCalories()).isEqualTo(created.getAggregates().getTotalCalories());
    }

    private static SessionEvent eventFor(String id) {
        switch (id) {
            case "A":
                return atMinute("A", 0, 100);
            case "B":
                return atMinute("B", 1, 200);
            default:
                return atMinute("C", 2, 300);
        }
    }
}
