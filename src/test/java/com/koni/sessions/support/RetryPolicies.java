package com.koni.sessions.support;

import com.koni.sessions.application.service.TransactionRetryPolicy;
import com.koni.sessions.infrastructure.config.IngestionProperties;
import com.koni.sessions.infrastructure.resilience.RetryConfiguration;

import java.time.Duration;

/**
 * Builds the production retry policy with a backoff short enough for unit tests.
 */
public final class RetryPolicies {

    private RetryPolicies() {
    }

    public static TransactionRetryPolicy fastRetryPolicy() {
        IngestionProperties properties = new IngestionProperties();
        properties.getTransaction().setInitialBackoff(Duration.ofMillis(1));

        RetryConfiguration configuration = new RetryConfiguration();
        return new TransactionRetryPolicy(configuration.sessionUpsertRetry(
                configuration.retryRegistry(configuration.sessionUpsertRetryConfig(properties))));
    }
}
