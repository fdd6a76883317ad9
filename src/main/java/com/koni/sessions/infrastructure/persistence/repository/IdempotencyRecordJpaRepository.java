package com.koni.sessions.infrastructure.persistence.repository;

import com.koni.sessions.infrastructure.persistence.entity.IdempotencyRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for IdempotencyRecordEntity persistence operations.
 */
@Repository
public interface IdempotencyRecordJpaRepository extends JpaRepository<IdempotencyRecordEntity, String> {
}
