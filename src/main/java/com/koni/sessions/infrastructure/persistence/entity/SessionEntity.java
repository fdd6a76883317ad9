package com.koni.sessions.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for persisting exercise session aggregates.
 *
 * New instances are always inserted with a plain persist, never merged, so a concurrent
 * creator of the same session fails on the primary key instead of overwriting it.
 * Updates go through the conditional version update of {@code SessionJpaRepository}.
 */
@Entity
@Table(
    name = "sessions",
    indexes = {
        @Index(
            name = "idx_sessions_user_id",
            columnList = "user_id"
        )
    }
)
@Getter
@Setter
@NoArgsConstructor
public class SessionEntity implements Persistable<String> {

    @Id
    @Column(name = "session_id", length = 255)
    private String sessionId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "total_duration", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalDuration;

    @Column(name = "total_distance", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalDistance;

    @Column(name = "total_calories", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalCalories;

    @Column(name = "total_steps", nullable = false)
    private long totalSteps;

    @Column(name = "event_count", nullable = false)
    private int eventCount;

    @Column(name = "last_event_time")
    private Instant lastEventTime;

    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    private boolean newEntity = true;

    public SessionEntity(String sessionId, String userId, Instant startTime, Instant endTime,
                         BigDecimal totalDuration, BigDecimal totalDistance, BigDecimal totalCalories,
                         long totalSteps, int eventCount, Instant lastEventTime, long version,
                         Instant createdAt, Instant updatedAt) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.startTime = startTime;
        this.endTime = endTime;
        this.totalDuration = totalDuration;
        this.totalDistance = totalDistance;
        this.totalCalories = totalCalories;
        this.totalSteps = totalSteps;
        this.eventCount = eventCount;
        this.lastEventTime = lastEventTime;
        this.version = version;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    @Override
    public String getId() {
        return sessionId;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    protected void markNotNew() {
        this.newEntity = false;
    }
}
