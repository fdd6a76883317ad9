package com.koni.sessions.application.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.sessions.application.port.IngestionObserver;
import com.koni.sessions.application.service.IdempotencyLedger;
import com.koni.sessions.application.service.SessionUpsertCoordinator;
import com.koni.sessions.application.validation.NormalizedSessionEvent;
import com.koni.sessions.application.validation.SessionEventNormalizer;
import com.koni.sessions.application.validation.SessionEventValidator;
import com.koni.sessions.application.validation.ValidationResult;
import com.koni.sessions.domain.exception.SessionIngestionException;
import com.koni.sessions.domain.exception.ValidationException;
import com.koni.sessions.domain.model.IdempotencyCheckResult;
import com.koni.sessions.domain.model.OrderValidationResult;
import com.koni.sessions.domain.model.SessionEvent;
import com.koni.sessions.domain.model.UpsertResult;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.koni.sessions.application.port.IngestionMetricNames.DUPLICATE_DETECTED;
import static com.koni.sessions.application.port.IngestionMetricNames.OUT_OF_ORDER;
import static com.koni.sessions.application.port.IngestionMetricNames.PROCESSING_DURATION;
import static com.koni.sessions.application.port.IngestionMetricNames.SOURCE_EVENT_EXISTS;
import static com.koni.sessions.application.port.IngestionMetricNames.SOURCE_IDEMPOTENCY_CACHE;
import static com.koni.sessions.application.port.IngestionMetricNames.TAG_SOURCE;
import static com.koni.sessions.application.port.IngestionMetricNames.VALIDATION_FAILED;

/**
 * Command handler for ingesting exercise session events.
 *
 * Responsibilities:
 * - Resolve the idempotency key and replay known requests from the ledger
 * - Validate and normalize the payload
 * - Mark the request processing, run the transactional upsert, cache the outcome
 * - Mark the request failed when anything unexpected happens
 * - Report duplicates, out-of-order arrivals, validation failures and timings
 *
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestSessionEventCommandHandler {

    static final String MISSING_KEY_MESSAGE =
            "Idempotency key is required (header: Idempotency-Key or body: idempotencyKey/eventId)";

    private final IdempotencyLedger idempotencyLedger;
    private final SessionUpsertCoordinator upsertCoordinator;
    private final SessionEventValidator validator;
    private final SessionEventNormalizer normalizer;
    private final IngestionObserver observer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Handles the IngestSessionEventCommand.
     * Retries carrying the same idempotency key receive the original outcome.
     *
     * @param command the raw event and idempotency keys of one request
     * @return the outcome together with the response to send
     * @throws ValidationException if the key is missing or too long, or the payload is invalid
     * @throws SessionIngestionException if processing fails for any other reason
     */
    @Observed(name = "command.handler", contextualName = "ingest-session-event")
    public IngestSessionEventResult handle(IngestSessionEventCommand command) {
        long startNanos = System.nanoTime();

        String idempotencyKey = command.resolveIdempotencyKey();
        if (idempotencyKey == null) {
            throw new ValidationException(MISSING_KEY_MESSAGE);
        }
        if (idempotencyKey.length() > validator.getMaxIdentifierLength()) {
            throw new ValidationException(String.format("Idempotency key exceeds maximum length: %d (max: %d)",
                    idempotencyKey.length(), validator.getMaxIdentifierLength()));
        }

        IdempotencyCheckResult check = idempotencyLedger.check(idempotencyKey);
        switch (check.getOutcome()) {
            case DUPLICATE_WITH_CACHED_RESPONSE:
                return replay(idempotencyKey, check);
            case DUPLICATE_IN_FLIGHT:
                observer.recordLog(IngestionObserver.Level.WARN, "ingest_request_in_flight",
                        context("idempotencyKey", idempotencyKey));
                return IngestSessionEventResult.inFlight();
            default:
                break;
        }

        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            observer.recordCounter(VALIDATION_FAILED, Map.of());
            observer.recordLog(IngestionObserver.Level.WARN, "ingest_request_validation_failed",
                    context("idempotencyKey", idempotencyKey,
                            "sessionId", command.getSessionId() != null ? command.getSessionId() : "unknown",
                            "errors", String.join(", ", validation.getErrors())));
            throw new ValidationException(validation.getErrors());
        }

        NormalizedSessionEvent normalized = normalizer.normalize(command);
        try {
            return process(idempotencyKey, normalized, startNanos);
        } catch (RuntimeException e) {
            throw fail(idempotencyKey, normalized.getSessionId(), e);
        }
    }

    private IngestSessionEventResult process(String idempotencyKey, NormalizedSessionEvent normalized, long startNanos) {
        String sessionId = normalized.getSessionId();

        idempotencyLedger.markProcessing(idempotencyKey, sessionId);

        SessionEvent event = normalized.toSessionEvent(clock.instant());
        UpsertResult result = upsertCoordinator.upsert(sessionId, normalized.getUserId(), event);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        if (result.isDuplicate()) {
            observer.recordCounter(DUPLICATE_DETECTED, Map.of(TAG_SOURCE, SOURCE_EVENT_EXISTS));
            observer.recordLog(IngestionObserver.Level.INFO, "ingest_request_duplicate",
                    context("idempotencyKey", idempotencyKey,
                            "sessionId", sessionId,
                            "eventId", event.getEventId(),
                            "source", SOURCE_EVENT_EXISTS));
        } else {
            reportOrder(sessionId, event, result.getOrderValidation());
            observer.recordLog(IngestionObserver.Level.INFO, "ingest_request",
                    context("idempotencyKey", idempotencyKey,
                            "sessionId", sessionId,
                            "eventId", event.getEventId(),
                            "timestamp", event.getTimestamp().toEpochMilli(),
                            "isDuplicate", false,
                            "processingTimeMs", elapsed.toMillis()));
        }

        IngestSessionEventResponse response = IngestSessionEventResponse.success(sessionId, result.getAggregates());
        idempotencyLedger.cacheResponse(idempotencyKey, sessionId, response);
        observer.recordDuration(PROCESSING_DURATION, elapsed, Map.of());

        return IngestSessionEventResult.processed(response);
    }

    private IngestSessionEventResult replay(String idempotencyKey, IdempotencyCheckResult check) {
        IngestSessionEventResponse cached = readCached(idempotencyKey, check.getCachedResponse());

        observer.recordCounter(DUPLICATE_DETECTED, Map.of(TAG_SOURCE, SOURCE_IDEMPOTENCY_CACHE));
        observer.recordLog(IngestionObserver.Level.INFO, "ingest_request_duplicate",
                context("idempotencyKey", idempotencyKey,
                        "source", SOURCE_IDEMPOTENCY_CACHE,
                        "status", check.getStatus()));

        return IngestSessionEventResult.replayed(cached);
    }

    private void reportOrder(String sessionId, SessionEvent event, OrderValidationResult order) {
        if (order == null || !order.isOutOfOrder()) {
            return;
        }
        observer.recordCounter(OUT_OF_ORDER, Map.of());
        observer.recordLog(IngestionObserver.Level.INFO, "ingest_request_out_of_order",
                context("sessionId", sessionId,
                        "eventId", event.getEventId(),
                        "expectedSequence", order.getExpectedSequence(),
                        "actualSequence", order.getActualSequence()));
    }

    /**
     * Records the failure and moves the key to FAILED so retries replay the error instead
     * of seeing the request in flight until the TTL runs out.
     */
    private SessionIngestionException fail(String idempotencyKey, String sessionId, RuntimeException cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();

        observer.recordLog(IngestionObserver.Level.ERROR, "ingest_request_error",
                context("idempotencyKey", idempotencyKey,
                        "sessionId", sessionId,
                        "error", message));

        SessionIngestionException failure = new SessionIngestionException(idempotencyKey, sessionId, message, cause);
        try {
            idempotencyLedger.markFailed(idempotencyKey, sessionId, IngestSessionEventResponse.failure(message));
        } catch (RuntimeException markFailure) {
            log.error("Could not mark idempotency key failed, it stays processing until expiry: key={}, sessionId={}",
                    idempotencyKey, sessionId, markFailure);
            failure.addSuppressed(markFailure);
        }
        return failure;
    }

    private IngestSessionEventResponse readCached(String idempotencyKey, String cachedResponse) {
        try {
            return objectMapper.readValue(cachedResponse, IngestSessionEventResponse.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cached response is unreadable for idempotency key " + idempotencyKey, e);
        }
    }

    private static Map<String, Object> context(Object... keyValues) {
        Map<String, Object> context = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            context.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return context;
    }
}
