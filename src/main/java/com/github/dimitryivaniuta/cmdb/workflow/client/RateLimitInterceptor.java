package com.github.dimitryivaniuta.cmdb.workflow.client;

import com.github.dimitryivaniuta.cmdb.metrics.CmdbMetrics;
import com.github.dimitryivaniuta.cmdb.workflow.ratelimit.RequestRateLimiter;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.Response;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Blocks the calling thread until the outbound limiter grants a slot. Runs once per attempt, so
 * retries are throttled too.
 */
@Slf4j
public class RateLimitInterceptor implements Interceptor {

    static final Duration UNKNOWN_RESET_WAIT = Duration.ofSeconds(60);

    /** Indirection over Thread.sleep so tests can observe waits without blocking. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final RequestRateLimiter limiter;
    private final Clock clock;
    private final Sleeper sleeper;
    private final CmdbMetrics metrics;

    public RateLimitInterceptor(RequestRateLimiter limiter, Clock clock, Sleeper sleeper, CmdbMetrics metrics) {
        this.limiter = limiter;
        this.clock = clock;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        while (!limiter.tryAcquire()) {
            Duration wait = waitFor(limiter.getResetTime(), clock.instant());
            metrics.n8nRateLimitWait();
            log.info("n8n rate limit reached ({}/{} per minute), waiting {}s before {} {}",
                    limiter.getCurrentRequests(), limiter.getMaxRequests(), wait.toSeconds(),
                    chain.request().method(), chain.request().url().encodedPath());
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while waiting for n8n rate limit");
            }
        }
        return chain.proceed(chain.request());
    }

    /** {@code ceil((reset - now) / 1s)} seconds, at least one; 60 seconds when the reset is unknown. */
    static Duration waitFor(Instant resetTime, Instant now) {
        if (resetTime == null) {
            return UNKNOWN_RESET_WAIT;
        }
        long millis = Duration.between(now, resetTime).toMillis();
        long seconds = Math.max(1, (millis + 999) / 1000);
        return Duration.ofSeconds(seconds);
    }
}
