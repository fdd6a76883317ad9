package com.koni.sessions.infrastructure.persistence.repository;

import com.koni.sessions.infrastructure.persistence.entity.SessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA repository for SessionEntity persistence operations.
 *
 * Spring Data JPA will automatically implement this interface at runtime,
 * providing standard CRUD operations and the conditional aggregate update below.
 */
@Repository
public interface SessionJpaRepository extends JpaRepository<SessionEntity, String> {

    /**
     * Overwrites the aggregates of a session only if it is still at the expected version,
     * incrementing the version in the same statement.
     *
     * Returns the number of rows updated: 0 means another writer got there first,
     * or the session does not exist.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SessionEntity s set "
            + "s.startTime = :startTime, "
            + "s.endTime = :endTime, "
            + "s.totalDuration = :totalDuration, "
            + "s.totalDistance = :totalDistance, "
            + "s.totalCalories = :totalCalories, "
            + "s.totalSteps = :totalSteps, "
            + "s.eventCount = :eventCount, "
            + "s.lastEventTime = :lastEventTime, "
            + "s.updatedAt = :updatedAt, "
            + "s.version = s.version + 1 "
            + "where s.sessionId = :sessionId and s.version = :expectedVersion")
    int updateAggregatesIfVersionMatches(@Param("sessionId") String sessionId,
                                         @Param("expectedVersion") long expectedVersion,
                                         @Param("startTime") Instant startTime,
                                         @Param("endTime") Instant endTime,
                                         @Param("totalDuration") BigDecimal totalDuration,
                                         @Param("totalDistance") BigDecimal totalDistance,
                                         @Param("totalCalories") BigDecimal totalCalories,
                                         @Param("totalSteps") long totalSteps,
                                         @Param("eventCount") int eventCount,
                                         @Param("lastEventTime") Instant lastEventTime,
                                         @Param("updatedAt") Instant updatedAt);
}
