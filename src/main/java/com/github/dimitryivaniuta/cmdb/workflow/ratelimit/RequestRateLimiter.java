package com.github.dimitryivaniuta.cmdb.workflow.ratelimit;

import java.time.Instant;

/**
 * Sliding-window limit on outbound workflow engine requests.
 */
public interface RequestRateLimiter {

    /** True when fewer than the maximum requests were recorded within the window. */
    boolean canMakeRequest();

    void recordRequest();

    /**
     * Instant at which the oldest in-window request leaves the window; now when nothing is recorded.
     */
    Instant getResetTime();

    int getCurrentRequests();

    int getMaxRequests();

    /** Atomic {@link #canMakeRequest()} + {@link #recordRequest()}. */
    boolean tryAcquire();
}
