package com.github.dimitryivaniuta.cmdb.workflow;

import java.util.List;

/**
 * @param workflowIds     explicit targets; empty polls the registry
 * @param includeInactive also poll inactive registry entries
 * @param batchSize       workflows per batch, null for the configured default
 * @param maxConcurrent   parallel fetches inside a batch, null for the configured default
 * @param skipAlerts      detect status changes without raising alerts
 */
public record PollingOptions(
        List<String> workflowIds,
        boolean includeInactive,
        Integer batchSize,
        Integer maxConcurrent,
        boolean skipAlerts
) {

    public static PollingOptions defaults() {
        return new PollingOptions(List.of(), false, null, null, false);
    }

    public List<String> workflowIds() {
        return workflowIds == null ? List.of() : workflowIds;
    }
}
