package com.github.dimitryivaniuta.cmdb.scheduler;

import java.time.Instant;

public record PollingStatus(
        boolean running,
        boolean scheduled,
        Instant nextRunTime,
        Instant lastRunTime,
        JobRunResult lastRunResult,
        long totalRuns,
        long successfulRuns,
        long failedRuns,
        int currentRetryAttempt,
        String schedule,
        String timezone
) {
}
