package com.github.dimitryivaniuta.cmdb.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.cmdb.outbox.OutboxEvent;
import com.github.dimitryivaniuta.cmdb.resource.DataChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorkflowExecutionRecordHandlerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private WorkflowExecutionRepository executions;
    private WorkflowAlertService alerts;
    private ApplicationEventPublisher events;
    private WorkflowExecutionRecordHandler handler;

    @BeforeEach
    void setUp() {
        executions = mock(WorkflowExecutionRepository.class);
        alerts = mock(WorkflowAlertService.class);
        events = mock(ApplicationEventPublisher.class);
        handler = new WorkflowExecutionRecordHandler(executions, alerts, mapper, events, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void newExecutionIsStoredAnnouncedAndAlerted() throws Exception {
        when(executions.findByExecutionId("901")).thenReturn(Optional.empty());

        handler.handle(event(new TriggeredExecution("wf-1", "901", "running", null, Map.of("region", "us-east-1"))));

        ArgumentCaptor<WorkflowExecution> saved = ArgumentCaptor.forClass(WorkflowExecution.class);
        verify(executions).save(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(saved.getValue().getStartTime()).isEqualTo(NOW);
        assertThat(saved.getValue().getExecutionData()).containsEntry("region", "us-east-1");

        verify(events).publishEvent(new DataChangedEvent("WORKFLOW", "901", "TRIGGER"));
        verify(alerts).raise("901", AlertType.MANUAL_TRIGGER, WorkflowAlertService.DEFAULT_RECIPIENTS);
    }

    @Test
    void executionAlreadyStoredByAPollOnlyGetsTheAlert() throws Exception {
        when(executions.findByExecutionId("902"))
                .thenReturn(Optional.of(WorkflowExecution.builder().executionId("902").build()));

        handler.handle(event(new TriggeredExecution("wf-1", "902", "succeeded", NOW, null)));

        verify(executions, never()).save(any());
        verify(events, never()).publishEvent(any(Object.class));
        verify(alerts).raise("902", AlertType.MANUAL_TRIGGER, WorkflowAlertService.DEFAULT_RECIPIENTS);
    }

    @Test
    void malformedPayloadFailsTheEvent() {
        OutboxEvent event = OutboxEvent.builder().eventType(WorkflowExecutionRecordHandler.EVENT_TYPE)
                .payloadJson("{not json").build();

        assertThatThrownBy(() -> handler.handle(event)).isInstanceOf(IllegalStateException.class);
    }

    private OutboxEvent event(TriggeredExecution payload) throws Exception {
        return OutboxEvent.builder()
                .eventType(WorkflowExecutionRecordHandler.EVENT_TYPE)
                .aggregateType("WORKFLOW_EXECUTION")
                .aggregateId(payload.executionId())
                .payloadJson(mapper.writeValueAsString(payload))
                .build();
    }
}
