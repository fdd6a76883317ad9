package com.koni.sessions.domain.service;

import com.koni.sessions.domain.exception.EmptyEventCollectionException;
import com.koni.sessions.domain.model.SessionAggregates;
import com.koni.sessions.domain.model.SessionEvent;
import com.koni.sessions.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static com.koni.sessions.support.SessionEvents.BASE;
import static com.koni.sessions.support.SessionEvents.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for SessionAggregateCalculator.
 */
@UnitTest
class SessionAggregateCalculatorTest {

    private final SessionEvent first = event("e1", BASE, 10, 100, 10, 100);
    private final SessionEvent second = event("e2", BASE.plusSeconds(60), 20, 200, 20, 200);
    private final SessionEvent third = event("e3", BASE.plusSeconds(120), 30, 300, 30, 300);

    @Test
    void shouldSumAllMeasuresAndCountEvents() {
        SessionAggregates aggregates = SessionAggregateCalculator.computeAggregates(List.of(first, second, third));

        assertThat(aggregates.getTotalDuration()).isEqualByComparingTo("60");
        assertThat(aggregates.getTotalDistance()).isEqualByComparingTo("600");
        assertThat(aggregates.getTotalCalories()).isEqualByComparingTo("60");
        assertThat(aggregates.getTotalSteps()).isEqualTo(600L);
        assertThat(aggregates.getEventCount()).isEqualTo(3);
    }

    @Test
    void shouldDeriveTimeBoundsRegardlessOfInputOrder() {
        SessionAggregates aggregates = SessionAggregateCalculator.computeAggregates(List.of(third, first, second));

        assertThat(aggregates.getStartTime()).isEqualTo(BASE);
        assertThat(aggregates.getEndTime()).isEqualTo(BASE.plusSeconds(120));
        assertThat(aggregates.getLastEventTime()).isEqualTo(aggregates.getEndTime());
    }

    @Test
    void shouldProduceIdenticalAggregatesForEveryPermutation() {
        SessionAggregates expected = SessionAggregateCalculator.computeAggregates(List.of(first, second, third));

        List<List<SessionEvent>> permutations = List.of(
                List.of(first, third, second),
                List.of(second, first, third),
                List.of(second, third, first),
                List.of(third, first, second),
                List.of(third, second, first)
        );

        for (List<SessionEvent> permutation : permutations) {
            assertThat(SessionAggregateCalculator.computeAggregates(permutation)).isEqualTo(expected);
        }
    }

    @Test
    void shouldTreatMissingMeasuresAsZero() {
        SessionEvent sparse = new SessionEvent("e4", BASE, null, new BigDecimal("12.5"), null, 0, null, BASE, 1);

        SessionAggregates aggregates = SessionAggregateCalculator.computeAggregates(List.of(sparse));

        assertThat(aggregates.getTotalDuration()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(aggregates.getTotalDistance()).isEqualByComparingTo("12.5");
        assertThat(aggregates.getTotalCalories()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(aggregates.getEventCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectEmptyEventCollection() {
        assertThatThrownBy(() -> SessionAggregateCalculator.computeAggregates(List.of()))
                .isInstanceOf(EmptyEventCollectionException.class)
                .hasMessage("Cannot compute aggregates from empty event list");
    }

    @Test
    void shouldAnchorDefaultAggregatesAtTimestamp() {
        Instant anchor = Instant.parse("2025-02-01T08:00:00Z");

        SessionAggregates aggregates = SessionAggregateCalculator.defaultAggregates(anchor);

        assertThat(aggregates.getStartTime()).isEqualTo(anchor);
        assertThat(aggregates.getEndTime()).isEqualTo(anchor);
        assertThat(aggregates.getLastEventTime()).isEqualTo(anchor);
        assertThat(aggregates.getTotalDistance()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(aggregates.getTotalSteps()).isZero();
        assertThat(aggregates.getEventCount()).isZero();
    }
}
