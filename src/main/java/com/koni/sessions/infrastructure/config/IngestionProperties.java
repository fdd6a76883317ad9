package com.koni.sessions.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Configuration properties for the session event ingestion pipeline.
 *
 * Controls idempotency record lifetime, upsert retry behavior and payload limits.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "exercise.ingest")
public class IngestionProperties {

    /**
     * Idempotency ledger configuration.
     */
    @Valid
    private Idempotency idempotency = new Idempotency();

    /**
     * Transactional upsert configuration.
     */
    @Valid
    private Transaction transaction = new Transaction();

    /**
     * Payload validation limits.
     */
    @Valid
    private Validation validation = new Validation();

    @Getter
    @Setter
    public static class Idempotency {

        /**
         * Lifetime of an idempotency record after its last write (default: 24 hours).
         */
        @NotNull
        private Duration ttl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Transaction {

        /**
         * Total attempts of one upsert, first attempt included.
         */
        @Min(1)
        private int maxAttempts = 3;

        /**
         * Wait before the first retry.
         */
        @NotNull
        private Duration initialBackoff = Duration.ofMillis(100);

        /**
         * Factor applied to the wait after each retry.
         */
        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;
    }

    @Getter
    @Setter
    public static class Validation {

        /**
         * Longest accepted identifier or idempotency key, the width of the key columns.
         */
        @Min(1)
        private int maxIdentifierLength = 255;

        /**
         * Maximum distance in meters (100 km).
         */
        @NotNull
        private BigDecimal maxDistance = new BigDecimal("100000");

        @NotNull
        private BigDecimal maxCalories = new BigDecimal("10000");

        @NotNull
        private BigDecimal maxSteps = new BigDecimal("100000");

        /**
         * Maximum interval duration in seconds (24 hours).
         */
        @NotNull
        private BigDecimal maxDuration = new BigDecimal("86400");

        /**
         * Allowed client clock drift into the future.
         */
        @NotNull
        private Duration maxFutureOffset = Duration.ofHours(1);

        /**
         * Oldest accepted event age.
         */
        @NotNull
        private Duration maxPastOffset = Duration.ofDays(30);
    }
}
