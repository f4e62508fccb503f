package com.civicintel.servicerequest.service;

import com.civicintel.servicerequest.config.IngestProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;

/**
 * Exponential backoff applied to Socrata calls.
 *
 * With the defaults (5 attempts, 1s base, x2, 16s cap) the waits between
 * attempts are 1s, 2s, 4s, 8s. Only {@link TransientFetchException} is retried;
 * anything else goes straight back to the caller.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier, Duration maxDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (baseDelay.toMillis() < 1) {
            throw new IllegalArgumentException("baseDelay must be at least 1ms, was " + baseDelay);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1, was " + multiplier);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay " + maxDelay + " is shorter than baseDelay " + baseDelay);
        }
    }

    public static RetryPolicy from(IngestProperties.RetrySettings settings) {
        return new RetryPolicy(settings.maxAttempts(), settings.baseDelay(), settings.multiplier(), settings.maxDelay());
    }

    public Retry toRetry(String name) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        baseDelay.toMillis(), multiplier, maxDelay.toMillis()))
                .retryExceptions(TransientFetchException.class)
                .build();
        return Retry.of(name, config);
    }
}
