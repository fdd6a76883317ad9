package com.koni.sessions.application.validation;

import com.koni.sessions.application.command.IngestSessionEventCommand;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Normalizes an already validated ingest command.
 */
@Component
public class SessionEventNormalizer {

    public NormalizedSessionEvent normalize(IngestSessionEventCommand command) {
        return new NormalizedSessionEvent(
                command.getEventId(),
                command.getSessionId(),
                command.getUserId(),
                TimestampNormalizer.normalize(command.getTimestamp()),
                orZero(command.getDuration()),
                orZero(command.getDistance()),
                orZero(command.getCalories()),
                orZero(command.getSteps()).longValueExact(),
                command.getSequenceNumber()
        );
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
