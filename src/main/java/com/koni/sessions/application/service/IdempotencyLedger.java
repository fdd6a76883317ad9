package com.koni.sessions.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.sessions.domain.model.IdempotencyCheckResult;
import com.koni.sessions.domain.model.IdempotencyRecord;
import com.koni.sessions.domain.model.IdempotencyStatus;
import com.koni.sessions.domain.repository.IdempotencyRecordRepository;
import com.koni.sessions.infrastructure.config.IngestionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable ledger of in-flight and completed client requests, keyed by idempotency key.
 * 
 * Responsibilities:
 * - Tell novel requests apart from retries of a known request
 * - Replay the cached outcome of COMPLETED and FAILED requests verbatim
 * - Report requests still PROCESSING as in flight, without a stale response
 * - Expire records after the configured TTL, deleting them lazily on read
 * 
 * check followed by markProcessing is not atomic: two first attempts racing on the
 * same key can both see NOVEL. The event id check of the upsert still keeps the
 * effect at most once.
 */
@Slf4j
@Service
public class IdempotencyLedger {

    private static final String EMPTY_RESPONSE = "{}";

    private final IdempotencyRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;

    public IdempotencyLedger(IdempotencyRecordRepository repository,
                             ObjectMapper objectMapper,
                             Clock clock,
                             IngestionProperties properties) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = properties.getIdempotency().getTtl();
    }

    /**
     * Looks up the record of an idempotency key.
     * 
     * @param idempotencyKey the client supplied key
     * @return NOVEL when absent or expired, otherwise the duplicate outcome
     */
    @Transactional
    public IdempotencyCheckResult check(String idempotencyKey) {
        Optional<IdempotencyRecord> found = repository.findByKey(idempotencyKey);
        if (found.isEmpty()) {
            return IdempotencyCheckResult.novel();
        }

        IdempotencyRecord record = found.get();
        if (record.isExpiredAt(clock.instant())) {
            log.debug("Idempotency record expired, deleting: key={}, expiresAt={}",
                    idempotencyKey, record.getExpiresAt());
            repository.delete(idempotencyKey);
            return IdempotencyCheckResult.novel();
        }

        if (record.getStatus() == IdempotencyStatus.PROCESSING) {
            return IdempotencyCheckResult.inFlight();
        }

        return IdempotencyCheckResult.cached(record.getStatus(), record.getResponse());
    }

    /**
     * Records that a request with this key started processing.
     * Overwrites whatever record the key had.
     */
    @Transactional
    public void markProcessing(String idempotencyKey, String sessionId) {
        Instant now = clock.instant();
        repository.save(new IdempotencyRecord(
                idempotencyKey,
                sessionId,
                IdempotencyStatus.PROCESSING,
                EMPTY_RESPONSE,
                now,
                now.plus(ttl)
        ));
        log.debug("Idempotency key marked processing: key={}, sessionId={}", idempotencyKey, sessionId);
    }

    /**
     * Caches the successful response of a request and marks it COMPLETED.
     * 
     * @param response the response payload, serialized as JSON
     */
    @Transactional
    public void cacheResponse(String idempotencyKey, String sessionId, Object response) {
        transition(idempotencyKey, sessionId, IdempotencyStatus.COMPLETED, response);
    }

    /**
     * Caches an error summary for a request and marks it FAILED.
     * 
     * @param errorSummary the error payload, serialized as JSON
     */
    @Transactional
    public void markFailed(String idempotencyKey, String sessionId, Object errorSummary) {
        transition(idempotencyKey, sessionId, IdempotencyStatus.FAILED, errorSummary);
    }

    private void transition(String idempotencyKey, String sessionId, IdempotencyStatus status, Object payload) {
        Instant now = clock.instant();
        Instant createdAt = repository.findByKey(idempotencyKey)
                .map(IdempotencyRecord::getCreatedAt)
                .orElse(now);

        repository.save(new IdempotencyRecord(
                idempotencyKey,
                sessionId,
                status,
                serialize(payload),
                createdAt,
                now.plus(ttl)
        ));
        log.debug("Idempotency key transitioned: key={}, sessionId={}, status={}", idempotencyKey, sessionId, status);
    }

    private String serialize(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Idempotency payload is not serializable: " + payload, e);
        }
    }
}
