package com.github.dimitryivaniuta.cmdb.outbox;

import com.github.dimitryivaniuta.cmdb.metrics.CmdbMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drains due outbox events. Claiming happens in one short transaction (rows get a lease so a
 * concurrent drainer skips them); each event is then dispatched in its own transaction.
 */
@Slf4j
@Service
public class OutboxProcessor {

    private static final int MAX_ERROR_CHARS = 2_000;

    private final OutboxEventRepository repo;
    private final Map<String, OutboxEventHandler> handlers;
    private final OutboxProperties props;
    private final CmdbMetrics metrics;
    private final Clock clock;
    private final TransactionTemplate tx;

    public OutboxProcessor(OutboxEventRepository repo,
                           List<OutboxEventHandler> handlers,
                           OutboxProperties props,
                           CmdbMetrics metrics,
                           Clock clock,
                           PlatformTransactionManager txManager) {
        this.repo = repo;
        this.handlers = handlers.stream()
                .collect(Collectors.toMap(OutboxEventHandler::eventType, Function.identity()));
        this.props = props;
        this.metrics = metrics;
        this.clock = clock;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * @return number of events applied successfully in this pass
     */
    public int processDue() {
        Instant now = clock.instant();
        List<Long> ids = tx.execute(status -> {
            List<OutboxEvent> due = repo.findDueForUpdate(now, PageRequest.of(0, props.getBatchSize()));
            Instant leaseUntil = now.plus(props.getLease());
            due.forEach(e -> e.setLeaseUntil(leaseUntil));
            return due.stream().map(OutboxEvent::getId).toList();
        });
        if (ids == null || ids.isEmpty()) {
            return 0;
        }

        int processed = 0;
        for (Long id : ids) {
            if (dispatch(id)) {
                processed++;
            }
        }
        return processed;
    }

    Duration backoffFor(int attempts) {
        long base = props.getBaseBackoff().toMillis();
        long max = props.getMaxBackoff().toMillis();
        int exponent = Math.max(0, Math.min(attempts - 1, 30));
        long delay = base * (1L << exponent);
        return Duration.ofMillis(Math.min(delay, max));
    }

    private boolean dispatch(Long id) {
        String[] type = {"unknown"};
        try {
            tx.executeWithoutResult(status -> {
                OutboxEvent event = repo.findById(id)
                        .orElseThrow(() -> new IllegalStateException("Outbox event vanished: " + id));
                type[0] = event.getEventType();
                OutboxEventHandler handler = handlers.get(event.getEventType());
                if (handler == null) {
                    throw new IllegalStateException("No outbox handler for event type " + event.getEventType());
                }
                handler.handle(event);
                event.markProcessed(clock.instant());
            });
            metrics.outboxProcessed(type[0], "processed");
            return true;
        } catch (RuntimeException ex) {
            recordFailure(id, ex);
            return false;
        }
    }

    private void recordFailure(Long id, RuntimeException cause) {
        tx.executeWithoutResult(status -> repo.findById(id).ifPresent(event -> {
            int attempts = event.getAttempts() + 1;
            event.setAttempts(attempts);
            event.setLeaseUntil(null);
            event.setLastError(truncate(cause.toString()));

            if (attempts >= props.getMaxAttempts()) {
                event.setStatus(OutboxEvent.STATUS_FAILED);
                metrics.outboxProcessed(event.getEventType(), "failed");
                log.error("Outbox event id={} type={} aggregate={}:{} failed permanently after {} attempts",
                        event.getId(), event.getEventType(), event.getAggregateType(),
                        event.getAggregateId(), attempts, cause);
            } else {
                Duration delay = backoffFor(attempts);
                event.setNextAttemptAt(clock.instant().plus(delay));
                metrics.outboxProcessed(event.getEventType(), "retry");
                log.warn("Outbox event id={} type={} attempt {} failed, retrying in {}: {}",
                        event.getId(), event.getEventType(), attempts, delay, cause.toString());
            }
        }));
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_ERROR_CHARS) return s;
        return s.substring(0, MAX_ERROR_CHARS);
    }
}
