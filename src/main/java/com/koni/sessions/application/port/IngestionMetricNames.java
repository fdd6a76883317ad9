package com.koni.sessions.application.port;

/**
 * Metric names and tag values reported through the {@link IngestionObserver}.
 */
public final class IngestionMetricNames {

    public static final String DUPLICATE_DETECTED = "exercise_session.ingest.duplicate_detected";
    public static final String OUT_OF_ORDER = "exercise_session.ingest.out_of_order_count";
    public static final String VALIDATION_FAILED = "exercise_session.ingest.validation_failed";
    public static final String TRANSACTION_RETRY = "exercise_session.ingest.transaction_retry";
    public static final String PROCESSING_DURATION = "exercise_session.ingest.duration";

    public static final String TAG_SOURCE = "source";
    public static final String TAG_ATTEMPT = "attempt";

    public static final String SOURCE_IDEMPOTENCY_CACHE = "idempotency_cache";
    public static final String SOURCE_EVENT_EXISTS = "event_exists";

    private IngestionMetricNames() {
    }
}
