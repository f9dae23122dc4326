package com.github.dimitryivaniuta.cmdb.workflow.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-process limiter keeping request timestamps in a deque.
 */
public class SlidingWindowRateLimiter implements RequestRateLimiter {

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(1);

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Deque<Instant> requests = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1");
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
    }

    public SlidingWindowRateLimiter(int maxRequests, Clock clock) {
        this(maxRequests, DEFAULT_WINDOW, clock);
    }

    @Override
    public synchronized boolean canMakeRequest() {
        evict(clock.instant());
        return requests.size() < maxRequests;
    }

    @Override
    public synchronized void recordRequest() {
        requests.addLast(clock.instant());
    }

    @Override
    public synchronized Instant getResetTime() {
        Instant oldest = requests.peekFirst();
        return oldest == null ? clock.instant() : oldest.plus(window);
    }

    @Override
    public synchronized int getCurrentRequests() {
        evict(clock.instant());
        return requests.size();
    }

    @Override
    public int getMaxRequests() {
        return maxRequests;
    }

    @Override
    public synchronized boolean tryAcquire() {
        Instant now = clock.instant();
        evict(now);
        if (requests.size() >= maxRequests) {
            return false;
        }
        requests.addLast(now);
        return true;
    }

    /** Drops timestamps with {@code now - t >= window}. */
    private void evict(Instant now) {
        Instant cutoff = now.minus(window);
        while (!requests.isEmpty() && !requests.peekFirst().isAfter(cutoff)) {
            requests.pollFirst();
        }
    }
}
