package com.github.dimitryivaniuta.cmdb.outbox;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * Due events, skipping rows another instance has already locked (lock timeout -2 = SKIP LOCKED).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            select e from OutboxEvent e
            where e.status = 'PENDING'
              and e.nextAttemptAt <= :now
              and (e.leaseUntil is null or e.leaseUntil < :now)
            order by e.id
            """)
    List<OutboxEvent> findDueForUpdate(@Param("now") Instant now, Pageable page);

    long countByStatus(String status);

    List<OutboxEvent> findByAggregateTypeAndAggregateId(String aggregateType, String aggregateId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            delete from OutboxEvent e
            where e.status = 'PROCESSED' and e.processedAt < :before
            """)
    int deleteProcessedBefore(@Param("before") Instant before);
}
