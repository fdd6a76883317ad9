package com.koni.sessions.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * What the ingest handler did with a request, independent of the transport.
 */
@Getter
@AllArgsConstructor
@ToString
public class IngestSessionEventResult {

    public enum Outcome {
        /**
         * The request was processed now; the event was stored or found to be a duplicate.
         */
        PROCESSED,

        /**
         * The request was seen before; the cached response is replayed.
         */
        REPLAYED,

        /**
         * A request with the same key is still being processed.
         */
        IN_FLIGHT
    }

    private final Outcome outcome;

    /**
     * The response to return, null for IN_FLIGHT.
     */
    private final IngestSessionEventResponse response;

    public static IngestSessionEventResult processed(IngestSessionEventResponse response) {
        return new IngestSessionEventResult(Outcome.PROCESSED, response);
    }

    public static IngestSessionEventResult replayed(IngestSessionEventResponse response) {
        return new IngestSessionEventResult(Outcome.REPLAYED, response);
    }

    public static IngestSessionEventResult inFlight() {
        return new IngestSessionEventResult(Outcome.IN_FLIGHT, null);
    }
}
