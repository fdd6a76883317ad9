package com.koni.sessions.domain.repository;

import com.koni.sessions.domain.model.IdempotencyRecord;

import java.util.Optional;

/**
 * Repository interface for idempotency records, keyed by idempotency key.
 * 
 * Following Hexagonal Architecture principles, this interface will be implemented
 * by infrastructure adapters (e.g., JPA repositories).
 */
public interface IdempotencyRecordRepository {

    /**
     * Finds the record stored for an idempotency key, expired or not.
     * 
     * @param idempotencyKey the client supplied idempotency key
     * @return an Optional containing the record if found, or empty if not found
     */
    Optional<IdempotencyRecord> findByKey(String idempotencyKey);

    /**
     * Creates or overwrites the record for its idempotency key.
     * 
     * @param record the record to store
     */
    void save(IdempotencyRecord record);

    /**
     * Deletes the record for an idempotency key if present.
     * 
     * @param idempotencyKey the client supplied idempotency key
     */
    void delete(String idempotencyKey);
}
