package com.koni.sessions.domain.service;

import com.koni.sessions.domain.model.OrderValidationResult;
import com.koni.sessions.domain.model.SessionEvent;
import com.koni.sessions.domain.model.SessionEventPatch;
import com.koni.sessions.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static com.koni.sessions.support.SessionEvents.BASE;
import static com.koni.sessions.support.SessionEvents.atMinute;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for EventOrderAdvisor.
 */
@UnitTest
class EventOrderAdvisorTest {

    @Test
    void shouldReportInOrderWithoutSequencesForFirstEvent() {
        OrderValidationResult result = EventOrderAdvisor.validateEventOrder(List.of(), atMinute("a", 0, 100));

        assertThat(result.isOutOfOrder()).isFalse();
        assertThat(result.getExpectedSequence()).isNull();
        assertThat(result.getActualSequence()).isNull();
    }

    @Test
    void shouldReportInOrderWhenEventIsLatest() {
        List<SessionEvent> existing = List.of(atMinute("a", 0, 100), atMinute("b", 1, 100));

        OrderValidationResult result = EventOrderAdvisor.validateEventOrder(existing, atMinute("c", 2, 100));

        assertThat(result.isOutOfOrder()).isFalse();
        assertThat(result.getExpectedSequence()).isEqualTo(3);
        assertThat(result.getActualSequence()).isEqualTo(3);
    }

    @Test
    void shouldFlagEventEarlierThanLatestAsOutOfOrder() {
        // A at 0, C at 2 stored; B at 1 arrives last
        List<SessionEvent> existing = List.of(atMinute("c", 2, 300), atMinute("a", 0, 100));

        OrderValidationResult result = EventOrderAdvisor.validateEventOrder(existing, atMinute("b", 1, 200));

        assertThat(result.isOutOfOrder()).isTrue();
        assertThat(result.getExpectedSequence()).isEqualTo(3);
        assertThat(result.getActualSequence()).isEqualTo(2);
    }

    @Test
    void shouldPlaceEventBeforeEverythingAtPositionOne() {
        List<SessionEvent> existing = List.of(atMinute("b", 5, 100), atMinute("c", 6, 100));

        OrderValidationResult result = EventOrderAdvisor.validateEventOrder(existing, atMinute("a", 1, 100));

        assertThat(result.isOutOfOrder()).isTrue();
        assertThat(result.getActualSequence()).isEqualTo(1);
    }

    @Test
    void shouldNotFlagEventWithSameTimestampAsLatest() {
        List<SessionEvent> existing = List.of(atMinute("a", 0, 100), atMinute("b", 1, 100));

        OrderValidationResult result = EventOrderAdvisor.validateEventOrder(existing, atMinute("c", 1, 100));

        assertThat(result.isOutOfOrder()).isFalse();
        assertThat(result.getActualSequence()).isEqualTo(3);
    }

    @Test
    void shouldOverlayPresentPatchFieldsAndBumpVersion() {
        SessionEvent existing = atMinute("a", 0, 100);
        SessionEventPatch patch = new SessionEventPatch();
        patch.setDistance(new BigDecimal("250"));
        patch.setSteps(42L);

        SessionEvent merged = EventOrderAdvisor.mergeEventData(existing, patch);

        assertThat(merged.getEventId()).isEqualTo("a");
        assertThat(merged.getDistance()).isEqualByComparingTo("250");
        assertThat(merged.getSteps()).isEqualTo(42L);
        assertThat(merged.getDuration()).isEqualByComparingTo(existing.getDuration());
        assertThat(merged.getTimestamp()).isEqualTo(existing.getTimestamp());
        assertThat(merged.getIngestedAt()).isEqualTo(BASE);
        assertThat(merged.getVersion()).isEqualTo(existing.getVersion() + 1);
    }

    @Test
    void shouldReplaceIngestedAtOnlyWhenPatchCarriesIt() {
        Instant reingested = BASE.plusSeconds(3600);
        SessionEventPatch patch = new SessionEventPatch();
        patch.setIngestedAt(reingested);

        SessionEvent merged = EventOrderAdvisor.mergeEventData(atMinute("a", 0, 100), patch);

        assertThat(merged.getIngestedAt()).isEqualTo(reingested);
    }
}
