package com.koni.sessions.infrastructure.persistence.entity;

import com.koni.sessions.domain.model.IdempotencyStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity for persisting idempotency records of ingest requests.
 * Saving a record for an existing key overwrites it.
 */
@Entity
@Table(
    name = "idempotency_records",
    indexes = {
        @Index(
            name = "idx_idempotency_records_expires_at",
            columnList = "expires_at"
        )
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyRecordEntity {

    @Id
    @Column(name = "idempotency_key", length = 255)
    private String idempotencyKey;

    @Column(name = "session_id", nullable = false)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private IdempotencyStatus status;

    @Column(name = "response", nullable = false, length = 8192)
    private String response;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;
}
