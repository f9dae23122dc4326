package com.github.dimitryivaniuta.cmdb.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLogEntry, Long> {

    List<AuditLogEntry> findByResourceTypeAndResourceIdOrderByOccurredAtAsc(String resourceType, String resourceId);
}
