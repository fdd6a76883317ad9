package com.koni.sessions.application.service;

import com.koni.sessions.domain.exception.SessionWriteConflictException;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for the session upsert transaction.
 * 
 * The policy is an explicit object around a Resilience4j {@link Retry}: max attempts and
 * backoff come from its configuration, and only conflict-class failures are retried.
 * Every other failure propagates on the first attempt. Once attempts are exhausted the
 * last conflict is rethrown to the caller.
 */
@Slf4j
@Component
public class TransactionRetryPolicy {

    private final Retry retry;

    public TransactionRetryPolicy(Retry sessionUpsertRetry) {
        this.retry = sessionUpsertRetry;
        registerRetryEventListeners();
    }

    /**
     * Decides whether a failure was caused by a concurrent modification of the same
     * session and is therefore worth another attempt.
     *
     * @param throwable the failure of one attempt
     * @return true for write conflicts, optimistic locking, serialization and deadlock failures
     */
    public static boolean isConflict(Throwable throwable) {
        return throwable instanceof SessionWriteConflictException
                || throwable instanceof ConcurrencyFailureException;
    }

    /**
     * Runs the action, running it again from scratch after each conflict until it
     * succeeds or the attempts are used up.
     *
     * @param action one complete attempt, typically a whole transaction
     * @param <T> the result type
     * @return the result of the first successful attempt
     */
    public <T> T execute(Supplier<T> action) {
        return retry.executeSupplier(action);
    }

    public int getMaxAttempts() {
        return retry.getRetryConfig().getMaxAttempts();
    }

    private void registerRetryEventListeners() {
        retry.getEventPublisher()
                .onRetry(event -> log.warn("Session upsert conflict, retrying: retry={}, waitMs={}, cause={}",
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null))
                .onError(event -> log.error("Session upsert failed after {} attempts",
                        event.getNumberOfRetryAttempts(), event.getLastThrowable()));
    }
}
