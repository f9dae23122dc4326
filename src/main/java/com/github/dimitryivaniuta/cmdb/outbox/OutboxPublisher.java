package com.github.dimitryivaniuta.cmdb.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.cmdb.web.RequestContextKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records a side effect to be applied later by {@link OutboxProcessor}.
 * Joins the caller's transaction, so the event commits or rolls back with the primary write.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxPublisher {

    private final OutboxEventRepository repo;
    private final ObjectMapper mapper;

    @Transactional
    public OutboxEvent publish(String eventType, String aggregateType, String aggregateId, Object payload) {
        OutboxEvent event = OutboxEvent.builder()
                .eventType(eventType)
                .aggregateType(aggregateType)
                .aggregateId(aggregateId)
                .payloadJson(write(payload))
                .status(OutboxEvent.STATUS_PENDING)
                .correlationId(MDC.get(RequestContextKeys.CORRELATION_ID_MDC_KEY))
                .build();
        OutboxEvent saved = repo.save(event);
        log.debug("Outbox event queued type={} aggregate={}:{} id={}",
                eventType, aggregateType, aggregateId, saved.getId());
        return saved;
    }

    private String write(Object payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Outbox payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
