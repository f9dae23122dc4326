package com.github.dimitryivaniuta.cmdb.workflow;

import java.time.Instant;
import java.util.List;

public record WorkflowStats(
        String workflowId,
        String workflowName,
        long totalExecutions,
        long successfulExecutions,
        long failedExecutions,
        double averageExecutionTimeMs,
        Instant lastExecutionTime,
        Instant lastSuccessTime,
        Instant lastFailureTime,
        double errorRate,
        List<ErrorCount> mostCommonErrors
) {

    public record ErrorCount(String error, long count) {
    }
}
