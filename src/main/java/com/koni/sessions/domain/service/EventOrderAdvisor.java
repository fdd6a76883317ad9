package com.koni.sessions.domain.service;

import com.koni.sessions.domain.model.OrderValidationResult;
import com.koni.sessions.domain.model.SessionEvent;
import com.koni.sessions.domain.model.SessionEventPatch;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Best-effort diagnostics about event ordering, plus the partial-update merge used by
 * update-in-place call sites.
 * 
 * Nothing here gates a write. Aggregate correctness comes from full recomputation; the
 * ordering signal only feeds logs and metrics.
 */
public final class EventOrderAdvisor {

    private EventOrderAdvisor() {
    }

    /**
     * Classifies an incoming event against the events already stored for its session.
     * 
     * The event is out of order when its timestamp is strictly earlier than the latest
     * stored timestamp. The expected sequence is the position it would take if it were
     * the newest event; the actual sequence is the position it lands on in timestamp order.
     *
     * @param existingEvents the stored events, in any order
     * @param newEvent the incoming event
     * @return the order classification
     */
    public static OrderValidationResult validateEventOrder(Collection<SessionEvent> existingEvents, SessionEvent newEvent) {
        if (existingEvents == null || existingEvents.isEmpty()) {
            return OrderValidationResult.inOrder();
        }

        List<SessionEvent> sorted = existingEvents.stream()
                .sorted(SessionAggregateCalculator.CHRONOLOGICAL)
                .collect(Collectors.toList());

        SessionEvent lastEvent = sorted.get(sorted.size() - 1);
        boolean outOfOrder = newEvent.getTimestamp().isBefore(lastEvent.getTimestamp());

        int landsAfter = (int) sorted.stream()
                .filter(existing -> !existing.getTimestamp().isAfter(newEvent.getTimestamp()))
                .count();

        return new OrderValidationResult(outOfOrder, sorted.size() + 1, landsAfter + 1);
    }

    /**
     * Overlays the non-null fields of a patch on an existing event.
     * The original ingestion time is kept unless the patch sets one, and the
     * version is incremented.
     *
     * @param existing the stored event
     * @param incoming the partial update
     * @return the merged event
     */
    public static SessionEvent mergeEventData(SessionEvent existing, SessionEventPatch incoming) {
        return new SessionEvent(
                existing.getEventId(),
                incoming.getTimestamp() != null ? incoming.getTimestamp() : existing.getTimestamp(),
                incoming.getDuration() != null ? incoming.getDuration() : existing.getDuration(),
                incoming.getDistance() != null ? incoming.getDistance() : existing.getDistance(),
                incoming.getCalories() != null ? incoming.getCalories() : existing.getCalories(),
                incoming.getSteps() != null ? incoming.getSteps() : existing.getSteps(),
                incoming.getSequenceNumber() != null ? incoming.getSequenceNumber() : existing.getSequenceNumber(),
                incoming.getIngestedAt() != null ? incoming.getIngestedAt() : existing.getIngestedAt(),
                existing.getVersion() + 1
        );
    }
}
