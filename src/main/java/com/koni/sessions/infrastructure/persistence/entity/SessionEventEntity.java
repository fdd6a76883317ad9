package com.koni.sessions.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for persisting session events.
 * Events are write-once: a row is inserted by persist and never updated afterwards.
 */
@Entity
@IdClass(SessionEventKey.class)
@Table(
    name = "session_events",
    indexes = {
        @Index(
            name = "idx_session_events_session_timestamp",
            columnList = "session_id, event_timestamp"
        )
    }
)
@Getter
@Setter
@NoArgsConstructor
public class SessionEventEntity implements Persistable<SessionEventKey> {

    @Id
    @Column(name = "session_id", length = 255)
    private String sessionId;

    @Id
    @Column(name = "event_id", length = 255)
    private String eventId;

    @Column(name = "event_timestamp", nullable = false)
    private Instant timestamp;

    @Column(name = "duration", nullable = false, precision = 19, scale = 4)
    private BigDecimal duration;

    @Column(name = "distance", nullable = false, precision = 19, scale = 4)
    private BigDecimal distance;

    @Column(name = "calories", nullable = false, precision = 19, scale = 4)
    private BigDecimal calories;

    @Column(name = "steps", nullable = false)
    private long steps;

    @Column(name = "sequence_number")
    private Long sequenceNumber;

    @Column(name = "ingested_at", nullable = false, updatable = false)
    private Instant ingestedAt;

    @Column(name = "version", nullable = false)
    private int version;

    @Transient
    private boolean newEntity = true;

    public SessionEventEntity(String sessionId, String eventId, Instant timestamp, BigDecimal duration,
                              BigDecimal distance, BigDecimal calories, long steps, Long sequenceNumber,
                              Instant ingestedAt, int version) {
        this.sessionId = sessionId;
        this.eventId = eventId;
        this.timestamp = timestamp;
        this.duration = duration;
        this.distance = distance;
        this.calories = calories;
        this.steps = steps;
        this.sequenceNumber = sequenceNumber;
        this.ingestedAt = ingestedAt;
        this.version = version;
    }

    @Override
    public SessionEventKey getId() {
        return new SessionEventKey(sessionId, eventId);
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
