package com.koni.sessions.infrastructure.observability;

import com.koni.sessions.application.port.IngestionObserver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Component for tracking ingestion metrics and structured ingest logs.
 * Counters and timers are registered lazily in the {@link MeterRegistry}, one per name and tag set.
 */
@Slf4j
@Component
public class MicrometerIngestionObserver implements IngestionObserver {

    private final MeterRegistry registry;

    public MicrometerIngestionObserver(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increment the named counter.
     */
    @Override
    public void recordCounter(String name, Map<String, String> tags) {
        try {
            Counter.builder(name)
                    .tags(toTags(tags))
                    .register(registry)
                    .increment();
            log.debug("Counter incremented: name={}, tags={}", name, tags);
        } catch (RuntimeException e) {
            log.warn("Failed to record counter {}", name, e);
        }
    }

    /**
     * Record one measured duration under the named timer.
     */
    @Override
    public void recordDuration(String name, Duration duration, Map<String, String> tags) {
        try {
            Timer.builder(name)
                    .tags(toTags(tags))
                    .publishPercentiles(0.5, 0.95, 0.99)
                    .register(registry)
                    .record(duration);
        } catch (RuntimeException e) {
            log.warn("Failed to record duration {}", name, e);
        }
    }

    @Override
    public void recordLog(Level level, String message, Map<String, Object> context) {
        switch (level) {
            case DEBUG:
                log.debug("{} {}", message, context);
                break;
            case WARN:
                log.warn("{} {}", message, context);
                break;
            case ERROR:
                log.error("{} {}", message, context);
                break;
            default:
                log.info("{} {}", message, context);
        }
    }

    private static List<Tag> toTags(Map<String, String> tags) {
        if (tags == null) {
            return List.of();
        }
        return tags.entrySet().stream()
                .map(entry -> Tag.of(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }
}
