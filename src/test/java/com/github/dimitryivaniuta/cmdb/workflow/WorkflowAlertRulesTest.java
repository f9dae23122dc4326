package com.github.dimitryivaniuta.cmdb.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.github.dimitryivaniuta.cmdb.workflow.ExecutionStatus.*;
import static org.assertj.core.api.Assertions.assertThat;

class WorkflowAlertRulesTest {

    @Test
    void newFailedExecutionAlertsOnlyWithAnErrorMessage() {
        assertThat(N8nWorkflowService.alertFor(null, FAILURE, true, "Node HTTP Request failed")).isEqualTo(AlertType.FAILURE);
        assertThat(N8nWorkflowService.alertFor(null, FAILURE, true, null)).isNull();
        assertThat(N8nWorkflowService.alertFor(null, SUCCESS, true, null)).isNull();
    }

    @Test
    void transitionIntoFailureAlertsOnlyWithAnErrorMessage() {
        assertThat(N8nWorkflowService.alertFor(RUNNING, FAILURE, false, "Node HTTP Request failed")).isEqualTo(AlertType.FAILURE);
        assertThat(N8nWorkflowService.alertFor(SUCCESS, FAILURE, false, "boom")).isEqualTo(AlertType.FAILURE);
        assertThat(N8nWorkflowService.alertFor(RUNNING, FAILURE, false, null)).isNull();
        assertThat(N8nWorkflowService.alertFor(SUCCESS, FAILURE, false, null)).isNull();
    }

    @Test
    void recoveryFromFailureAlertsSuccess() {
        assertThat(N8nWorkflowService.alertFor(FAILURE, SUCCESS, false, null)).isEqualTo(AlertType.SUCCESS);
        assertThat(N8nWorkflowService.alertFor(RUNNING, SUCCESS, false, null)).isNull();
    }

    @Test
    void unchangedStatusNeverAlerts() {
        assertThat(N8nWorkflowService.alertFor(FAILURE, FAILURE, false, "still failing")).isNull();
        assertThat(N8nWorkflowService.alertFor(RUNNING, CANCELLED, false, null)).isNull();
    }

    @Test
    void remoteExecutionReadsErrorAndDuration() throws Exception {
        var node = new ObjectMapper().readTree("""
                {"id":"99","status":"error","startedAt":"2024-05-01T10:00:00.000Z","stoppedAt":"2024-05-01T10:00:02.500Z",
                 "data":{"resultData":{"error":{"message":"Timeout"}}}}
                """);

        RemoteExecution remote = RemoteExecution.from(node, "wf-1");

        assertThat(remote.workflowId()).isEqualTo("wf-1");
        assertThat(remote.startedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(remote.durationMs()).isEqualTo(2_500L);
        assertThat(remote.errorMessage()).isEqualTo("Timeout");
        assertThat(remote.localStatus()).isEqualTo(FAILURE);
    }

    @Test
    void legacyFinishedFlagMapsToStatus() throws Exception {
        var node = new ObjectMapper().readTree("{\"id\":\"5\",\"workflowId\":\"wf-2\",\"finished\":true}");

        RemoteExecution remote = RemoteExecution.from(node, "ignored");

        assertThat(remote.workflowId()).isEqualTo("wf-2");
        assertThat(remote.localStatus()).isEqualTo(SUCCESS);
        assertThat(remote.durationMs()).isNull();
    }
}
