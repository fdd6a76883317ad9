package com.koni.sessions.domain.service;

import com.koni.sessions.domain.exception.EmptyEventCollectionException;
import com.koni.sessions.domain.model.SessionAggregates;
import com.koni.sessions.domain.model.SessionEvent;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes session aggregates from the complete event history of a session.
 * 
 * Aggregates are always recomputed from scratch rather than applied as deltas, so the
 * result only depends on the set of events and never on the order they arrived in.
 */
public final class SessionAggregateCalculator {

    /**
     * Timestamp order with the event id as tie breaker, so equal timestamps sort the
     * same way whatever order the store returns them in.
     */
    public static final Comparator<SessionEvent> CHRONOLOGICAL = Comparator
            .comparing(SessionEvent::getTimestamp)
            .thenComparing(SessionEvent::getEventId);

    private SessionAggregateCalculator() {
    }

    /**
     * Computes the aggregates over a non-empty collection of events.
     *
     * @param events the events of one session, in any order
     * @return totals, count and time bounds of the events
     * @throws EmptyEventCollectionException if events is empty
     */
    public static SessionAggregates computeAggregates(Collection<SessionEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new EmptyEventCollectionException("Cannot compute aggregates from empty event list");
        }

        List<SessionEvent> sorted = events.stream()
                .sorted(CHRONOLOGICAL)
                .collect(Collectors.toList());

        Instant first = sorted.get(0).getTimestamp();
        Instant last = sorted.get(sorted.size() - 1).getTimestamp();

        return new SessionAggregates(
                first,
                last,
                sum(sorted, SessionEvent::getDuration),
                sum(sorted, SessionEvent::getDistance),
                sum(sorted, SessionEvent::getCalories),
                sorted.stream().mapToLong(SessionEvent::getSteps).sum(),
                sorted.size(),
                last
        );
    }

    /**
     * Creates zero valued aggregates anchored at the given instant, for callers that
     * need a baseline before any event exists.
     *
     * @param timestamp the anchor used for start, end and last event time
     * @return aggregates with zero totals and zero events
     */
    public static SessionAggregates defaultAggregates(Instant timestamp) {
        return new SessionAggregates(
                timestamp,
                timestamp,
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                0L,
                0,
                timestamp
        );
    }

    // missing measures count as zero
    private static BigDecimal sum(List<SessionEvent> events, Function<SessionEvent, BigDecimal> measure) {
        return events.stream()
                .map(measure)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
