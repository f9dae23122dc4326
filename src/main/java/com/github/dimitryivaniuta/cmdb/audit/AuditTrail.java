package com.github.dimitryivaniuta.cmdb.audit;

import com.github.dimitryivaniuta.cmdb.outbox.OutboxPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Writes the audit line for a resource mutation and queues the persistent audit row through the
 * outbox, inside the mutation's own transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditTrail {

    public static final String EVENT_TYPE = "audit.operation";

    private final OutboxPublisher outbox;
    private final Clock clock;

    public void logOperation(String operation, String resourceType, Object resourceId, String userId,
                             Map<String, Object> metadata) {
        String id = String.valueOf(resourceId);
        log.info("AUDIT operation={} resourceType={} id={} userId={} metadata={}",
                operation, resourceType, id, userId, metadata);
        outbox.publish(EVENT_TYPE, resourceType, id,
                new AuditEvent(operation, resourceType, id, userId, metadata, clock.instant()));
    }
}
