package com.github.dimitryivaniuta.cmdb.audit;

import java.time.Instant;
import java.util.Map;

public record AuditEvent(
        String operation,
        String resourceType,
        String resourceId,
        String userId,
        Map<String, Object> metadata,
        Instant occurredAt
) {}
