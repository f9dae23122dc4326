package com.github.dimitryivaniuta.cmdb.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.cmdb.outbox.OutboxEvent;
import com.github.dimitryivaniuta.cmdb.outbox.OutboxEventHandler;
import com.github.dimitryivaniuta.cmdb.resource.DataChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Creates the local record and the manual-trigger alert for an execution started through the API.
 * A poll may already have stored the execution; then only the alert is added.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkflowExecutionRecordHandler implements OutboxEventHandler {

    public static final String EVENT_TYPE = "workflow.execution.triggered";

    private final WorkflowExecutionRepository executions;
    private final WorkflowAlertService alerts;
    private final ObjectMapper mapper;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    @Override
    public String eventType() {
        return EVENT_TYPE;
    }

    @Override
    public void handle(OutboxEvent event) {
        TriggeredExecution triggered = read(event.getPayloadJson());

        if (executions.findByExecutionId(triggered.executionId()).isEmpty()) {
            executions.save(WorkflowExecution.builder()
                    .workflowId(triggered.workflowId())
                    .executionId(triggered.executionId())
                    .status(triggered.remoteStatus() == null
                            ? ExecutionStatus.RUNNING
                            : ExecutionStatus.fromRemote(triggered.remoteStatus()))
                    .startTime(triggered.startedAt() != null ? triggered.startedAt() : clock.instant())
                    .executionData(triggered.data())
                    .build());
            log.info("Recorded triggered execution {} of workflow {}", triggered.executionId(), triggered.workflowId());
            events.publishEvent(new DataChangedEvent("WORKFLOW", triggered.executionId(), "TRIGGER"));
        }
        alerts.raise(triggered.executionId(), AlertType.MANUAL_TRIGGER, WorkflowAlertService.DEFAULT_RECIPIENTS);
    }

    private TriggeredExecution read(String json) {
        try {
            return mapper.readValue(json, TriggeredExecution.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed triggered execution payload", e);
        }
    }
}
