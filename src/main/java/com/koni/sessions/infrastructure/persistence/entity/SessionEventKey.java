package com.koni.sessions.infrastructure.persistence.entity;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite primary key of {@link SessionEventEntity}: an event id is unique within its session.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class SessionEventKey implements Serializable {

    private String sessionId;
    private String eventId;
}
