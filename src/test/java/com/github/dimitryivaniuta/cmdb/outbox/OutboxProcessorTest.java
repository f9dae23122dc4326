package com.github.dimitryivaniuta.cmdb.outbox;

import com.github.dimitryivaniuta.cmdb.metrics.CmdbMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OutboxProcessorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String TYPE = "audit.operation";

    private OutboxEventRepository repo;
    private OutboxEventHandler handler;
    private OutboxProperties props;
    private OutboxProcessor processor;

    @BeforeEach
    void setUp() {
        repo = mock(OutboxEventRepository.class);
        handler = mock(OutboxEventHandler.class);
        when(handler.eventType()).thenReturn(TYPE);
        PlatformTransactionManager txManager = mock(PlatformTransactionManager.class);
        when(txManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        props = new OutboxProperties();
        props.setBaseBackoff(Duration.ofSeconds(5));
        props.setMaxBackoff(Duration.ofMinutes(1));
        props.setMaxAttempts(3);
        processor = new OutboxProcessor(repo, List.of(handler), props,
                new CmdbMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC), txManager);
    }

    @Test
    void backoffDoublesAndIsCapped() {
        assertThat(processor.backoffFor(1)).isEqualTo(Duration.ofSeconds(5));
        assertThat(processor.backoffFor(2)).isEqualTo(Duration.ofSeconds(10));
        assertThat(processor.backoffFor(4)).isEqualTo(Duration.ofSeconds(40));
        assertThat(processor.backoffFor(5)).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void successfulEventIsMarkedProcessed() {
        OutboxEvent event = event(1L, 0);
        when(repo.findDueForUpdate(eq(NOW), any())).thenReturn(List.of(event));
        when(repo.findById(1L)).thenReturn(Optional.of(event));

        assertThat(processor.processDue()).isEqualTo(1);

        verify(handler).handle(event);
        assertThat(event.getStatus()).isEqualTo(OutboxEvent.STATUS_PROCESSED);
        assertThat(event.getProcessedAt()).isEqualTo(NOW);
        assertThat(event.getLeaseUntil()).isNull();
    }

    @Test
    void failedEventIsRescheduledWithBackoff() {
        OutboxEvent event = event(2L, 1);
        when(repo.findDueForUpdate(eq(NOW), any())).thenReturn(List.of(event));
        when(repo.findById(2L)).thenReturn(Optional.of(event));
        doThrow(new IllegalStateException("audit sink down")).when(handler).handle(event);

        assertThat(processor.processDue()).isZero();

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.STATUS_PENDING);
        assertThat(event.getAttempts()).isEqualTo(2);
        assertThat(event.getNextAttemptAt()).isEqualTo(NOW.plusSeconds(10));
        assertThat(event.getLastError()).contains("audit sink down");
        assertThat(event.getLeaseUntil()).isNull();
    }

    @Test
    void eventFailsPermanentlyAfterMaxAttempts() {
        OutboxEvent event = event(3L, 2);
        when(repo.findDueForUpdate(eq(NOW), any())).thenReturn(List.of(event));
        when(repo.findById(3L)).thenReturn(Optional.of(event));
        doThrow(new IllegalStateException("still down")).when(handler).handle(event);

        processor.processDue();

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.STATUS_FAILED);
        assertThat(event.getAttempts()).isEqualTo(3);
    }

    @Test
    void unknownEventTypeCountsAsFailure() {
        OutboxEvent event = event(4L, 0);
        event.setEventType("report.unknown");
        when(repo.findDueForUpdate(eq(NOW), any())).thenReturn(List.of(event));
        when(repo.findById(4L)).thenReturn(Optional.of(event));

        assertThat(processor.processDue()).isZero();
        assertThat(event.getLastError()).contains("No outbox handler");
    }

    @Test
    void nothingDueDoesNothing() {
        when(repo.findDueForUpdate(eq(NOW), any())).thenReturn(List.of());

        assertThat(processor.processDue()).isZero();
    }

    private static OutboxEvent event(Long id, int attempts) {
        return OutboxEvent.builder()
                .id(id)
                .eventType(TYPE)
                .aggregateType("VPC")
                .aggregateId("10")
                .payloadJson("{}")
                .status(OutboxEvent.STATUS_PENDING)
                .attempts(attempts)
                .nextAttemptAt(NOW)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
