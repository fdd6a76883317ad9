package com.koni.sessions.application.port;

import java.time.Duration;
import java.util.Map;

/**
 * Port interface for the observability sink of the ingestion path.
 * This interface follows the Hexagonal Architecture pattern, defining an output port
 * that will be implemented by infrastructure adapters (e.g., Micrometer and SLF4J).
 * 
 * Calls are fire-and-forget: implementations must not throw back into the caller.
 * Counter tags must stay low-cardinality; identifiers belong in the log context.
 */
public interface IngestionObserver {

    /**
     * Increments a named counter by one.
     * 
     * @param name the metric name, see {@link IngestionMetricNames}
     * @param tags low-cardinality tags
     */
    void recordCounter(String name, Map<String, String> tags);

    /**
     * Records the duration of one operation under a named timer.
     * 
     * @param name the metric name, see {@link IngestionMetricNames}
     * @param duration the measured duration
     * @param tags low-cardinality tags
     */
    void recordDuration(String name, Duration duration, Map<String, String> tags);

    /**
     * Emits a structured log record.
     * 
     * @param level the severity
     * @param message a stable event name such as {@code ingest_request}
     * @param context structured facts about the event
     */
    void recordLog(Level level, String message, Map<String, Object> context);

    enum Level {
        DEBUG,
        INFO,
        WARN,
        ERROR
    }
}
