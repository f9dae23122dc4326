package com.github.dimitryivaniuta.cmdb.scheduler;

import com.github.dimitryivaniuta.cmdb.workflow.PollingResult;

import java.time.Instant;

public record JobRunResult(
        String jobName,
        Instant startTime,
        Instant endTime,
        boolean success,
        String error,
        long durationMs,
        PollingResult result
) {
}
