package com.koni.sessions.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query to retrieve the current aggregates of one exercise session.
 */
@Getter
@AllArgsConstructor
public class GetSessionQuery {

    private final String sessionId;
}
