package com.koni.sessions.infrastructure.observability;

import com.koni.sessions.application.port.IngestionObserver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static com.koni.sessions.application.port.IngestionMetricNames.DUPLICATE_DETECTED;
import static com.koni.sessions.application.port.IngestionMetricNames.PROCESSING_DURATION;
import static com.koni.sessions.application.port.IngestionMetricNames.VALIDATION_FAILED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Unit tests for MicrometerIngestionObserver.
 * Tests counter increments, timer recording, and metric names/tags.
 */
class MicrometerIngestionObserverTest {

    private MeterRegistry meterRegistry;
    private MicrometerIngestionObserver observer;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        observer = new MicrometerIngestionObserver(meterRegistry);
    }

    @Test
    void shouldIncrementCounterPerTagSet() {
        // When
        observer.recordCounter(DUPLICATE_DETECTED, Map.of("source", "idempotency_cache"));
        observer.recordCounter(DUPLICATE_DETECTED, Map.of("source", "idempotency_cache"));
        observer.recordCounter(DUPLICATE_DETECTED, Map.of("source", "event_exists"));

        // Then
        Counter cached = meterRegistry.find(DUPLICATE_DETECTED).tag("source", "idempotency_cache").counter();
        Counter existing = meterRegistry.find(DUPLICATE_DETECTED).tag("source", "event_exists").counter();
        assertThat(cached).isNotNull();
        assertThat(cached.count()).isEqualTo(2.0);
        assertThat(existing).isNotNull();
        assertThat(existing.count()).isEqualTo(1.0);
    }

    @Test
    void shouldIncrementUntaggedCounter() {
        observer.recordCounter(VALIDATION_FAILED, Map.of());

        assertThat(meterRegistry.get(VALIDATION_FAILED).counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldRecordDuration() {
        observer.recordDuration(PROCESSING_DURATION, Duration.ofMillis(250), Map.of());

        Timer timer = meterRegistry.find(PROCESSING_DURATION).timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0);
    }

    @Test
    void shouldAcceptNullValuesInLogContext() {
        Map<String, Object> context = new HashMap<>();
        context.put("sessionId", "session-1");
        context.put("expectedSequence", null);

        assertThatCode(() -> observer.recordLog(IngestionObserver.Level.INFO, "ingest_request", context))
                .doesNotThrowAnyException();
    }

    @Test
    void shouldNotThrowWhenMeterCannotBeRegistered() {
        // same name already registered as a timer
        observer.recordDuration(PROCESSING_DURATION, Duration.ofMillis(1), Map.of());

        assertThatCode(() -> observer.recordCounter(PROCESSING_DURATION, Map.of()))
                .doesNotThrowAnyException();
    }
}
