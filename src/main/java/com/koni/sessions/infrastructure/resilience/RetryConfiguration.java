package com.koni.sessions.infrastructure.resilience;

import com.koni.sessions.application.service.TransactionRetryPolicy;
import com.koni.sessions.infrastructure.config.IngestionProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the retry applied to session upsert transactions.
 * Provides resilience against write conflicts between concurrent upserts of one session.
 */
@Configuration
public class RetryConfiguration {

    /**
     * Creates the RetryConfig for session upserts.
     * 
     * Configuration (defaults from exercise.ingest.transaction):
     * - Max attempts: 3, first attempt included
     * - Backoff: exponential, 100ms doubling (100ms, 200ms)
     * - Retried failures: write conflicts only, see {@link TransactionRetryPolicy#isConflict}
     * 
     * @param properties ingestion configuration
     * @return RetryConfig with the configured settings
     */
    @Bean
    public RetryConfig sessionUpsertRetryConfig(IngestionProperties properties) {
        IngestionProperties.Transaction transaction = properties.getTransaction();
        return RetryConfig.custom()
                .maxAttempts(transaction.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        transaction.getInitialBackoff(),
                        transaction.getBackoffMultiplier()))
                .retryOnException(TransactionRetryPolicy::isConflict)
                .build();
    }

    @Bean
    public RetryRegistry retryRegistry(RetryConfig sessionUpsertRetryConfig) {
        return RetryRegistry.of(sessionUpsertRetryConfig);
    }

    /**
     * Creates the Retry instance named "session-upsert" used by the TransactionRetryPolicy.
     * 
     * @param registry the retry registry
     * @return Retry instance for session upserts
     */
    @Bean
    public Retry sessionUpsertRetry(RetryRegistry registry) {
        return registry.retry("session-upsert");
    }
}
