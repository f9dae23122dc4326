package com.github.dimitryivaniuta.cmdb.scheduler;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Partial scheduler reconfiguration; null fields keep their current value.
 */
public record PollingConfigUpdate(
        Boolean enabled,
        String schedule,
        String timezone,
        @Min(1) @Max(10) Integer retryAttempts,
        @Min(0) @Max(60) Integer retryDelayMinutes,
        @Min(1) @Max(100) Integer batchSize,
        @Min(1) @Max(50) Integer maxConcurrent
) {
}
