package com.github.dimitryivaniuta.cmdb.workflow;

import java.util.List;

/**
 * @param errors workflows returned by the engine that could not be stored locally
 */
public record DiscoveryResult(int discovered, int registered, List<WorkflowRegistryEntry> workflows,
                              List<DiscoveryError> errors) {

    public record DiscoveryError(String workflowId, String error) {
    }
}
