package com.github.dimitryivaniuta.cmdb.workflow;

import java.util.List;

public record SyncOptions(boolean fullSync, Boolean syncExecutions, boolean cleanupOrphaned, List<String> workflowIds) {

    public boolean shouldSyncExecutions() {
        return syncExecutions == null || syncExecutions;
    }
}
