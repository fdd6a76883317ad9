package com.koni.sessions.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Partial event data for update-in-place call sites. Null fields leave the
 * existing value untouched.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SessionEventPatch {

    private Instant timestamp;
    private BigDecimal duration;
    private BigDecimal distance;
    private BigDecimal calories;
    private Long steps;
    private Long sequenceNumber;
    private Instant ingestedAt;
}
