package com.github.dimitryivaniuta.cmdb.workflow;

import java.time.Instant;
import java.util.Map;

/**
 * Outbox payload for a manually triggered execution.
 */
public record TriggeredExecution(
        String workflowId,
        String executionId,
        String remoteStatus,
        Instant startedAt,
        Map<String, Object> data
) {
}
