package com.github.dimitryivaniuta.cmdb.scheduler;

/**
 * @param status {@code healthy}, {@code degraded} (last run failed) or {@code unhealthy}
 */
public record PollingHealth(String status, boolean schedulerRunning, WorkflowPollingJob.JobHealth job,
                            PollingStatus polling) {

    public boolean isHealthy() {
        return "healthy".equals(status);
    }
}
