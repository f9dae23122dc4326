package com.github.dimitryivaniuta.cmdb.workflow.client;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

/**
 * Retry settings for engine calls: {@code maxAttempts} total calls, waiting
 * {@code min(base * 2^(attempt-1), max)} between them, or a fixed {@code base} when exponential
 * backoff is off. Only {@link N8nClientException#isRetryable() retryable} failures are retried.
 */
public record N8nRetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, boolean exponentialBackoff) {

    public static N8nRetryPolicy from(N8nProperties.Retry retry) {
        return new N8nRetryPolicy(retry.getMaxAttempts(), retry.getBaseDelayMs(), retry.getMaxDelayMs(),
                retry.isExponentialBackoff());
    }

    /**
     * @param attempt 1-based number of the attempt that just failed
     */
    public long delayMillis(int attempt) {
        if (!exponentialBackoff) {
            return baseDelayMs;
        }
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long delay = baseDelayMs * (1L << exponent);
        return Math.min(delay, maxDelayMs);
    }

    public Retry toRetry(String name) {
        IntervalFunction interval = attempt -> delayMillis(attempt);
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(interval)
                .retryOnException(ex -> ex instanceof N8nClientException n && n.isRetryable())
                .build();
        return Retry.of(name, config);
    }
}
