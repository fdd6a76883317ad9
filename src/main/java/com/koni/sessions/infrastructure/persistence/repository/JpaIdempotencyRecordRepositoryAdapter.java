package com.koni.sessions.infrastructure.persistence.repository;

import com.koni.sessions.domain.model.IdempotencyRecord;
import com.koni.sessions.domain.repository.IdempotencyRecordRepository;
import com.koni.sessions.infrastructure.persistence.entity.IdempotencyRecordEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * JPA adapter for IdempotencyRecordRepository.
 * Saving overwrites an existing record with the same key.
 */
@Component
@RequiredArgsConstructor
public class JpaIdempotencyRecordRepositoryAdapter implements IdempotencyRecordRepository {

    private final IdempotencyRecordJpaRepository jpaRepository;

    @Override
    public Optional<IdempotencyRecord> findByKey(String idempotencyKey) {
        if (idempotencyKey == null) {
            throw new IllegalArgumentException("Idempotency key cannot be null");
        }

        return jpaRepository.findById(idempotencyKey)
            .map(this::toDomain);
    }

    @Override
    public void save(IdempotencyRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("IdempotencyRecord cannot be null");
        }

        jpaRepository.save(toEntity(record));
    }

    @Override
    public void delete(String idempotencyKey) {
        jpaRepository.deleteById(idempotencyKey);
    }

    private IdempotencyRecord toDomain(IdempotencyRecordEntity entity) {
        return new IdempotencyRecord(
            entity.getIdempotencyKey(),
            entity.getSessionId(),
            entity.getStatus(),
            entity.getResponse(),
            entity.getCreatedAt(),
            entity.getExpiresAt()
        );
    }

    private IdempotencyRecordEntity toEntity(IdempotencyRecord record) {
        return new IdempotencyRecordEntity(
            record.getIdempotencyKey(),
            record.getSessionId(),
            record.getStatus(),
            record.getResponse(),
            record.getCreatedAt(),
            record.getExpiresAt()
        );
    }
}
