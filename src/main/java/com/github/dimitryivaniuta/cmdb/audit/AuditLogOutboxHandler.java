package com.github.dimitryivaniuta.cmdb.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.cmdb.outbox.OutboxEvent;
import com.github.dimitryivaniuta.cmdb.outbox.OutboxEventHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AuditLogOutboxHandler implements OutboxEventHandler {

    private final AuditLogRepository repo;
    private final ObjectMapper mapper;

    @Override
    public String eventType() {
        return AuditTrail.EVENT_TYPE;
    }

    @Override
    public void handle(OutboxEvent event) {
        AuditEvent audit = read(event.getPayloadJson());
        repo.save(AuditLogEntry.builder()
                .operation(audit.operation())
                .resourceType(audit.resourceType())
                .resourceId(audit.resourceId())
                .userId(audit.userId())
                .metadataJson(write(audit))
                .correlationId(event.getCorrelationId())
                .occurredAt(audit.occurredAt())
                .build());
    }

    private AuditEvent read(String json) {
        try {
            return mapper.readValue(json, AuditEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed audit payload", e);
        }
    }

    private String write(AuditEvent audit) {
        if (audit.metadata() == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(audit.metadata());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit metadata is not serializable", e);
        }
    }
}
