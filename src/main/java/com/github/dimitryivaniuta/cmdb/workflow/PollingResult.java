package com.github.dimitryivaniuta.cmdb.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

public record PollingResult(
        int totalWorkflows,
        int polledWorkflows,
        int updatedExecutions,
        int triggeredAlerts,
        List<PollingError> errors,
        long durationMs
) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param type {@code workflow_poll}, {@code execution_update} or {@code alert_trigger}
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PollingError(String workflowId, String executionId, String error, String type) {

        public static final String WORKFLOW_POLL = "workflow_poll";
        public static final String EXECUTION_UPDATE = "execution_update";
        public static final String ALERT_TRIGGER = "alert_trigger";
    }
}
