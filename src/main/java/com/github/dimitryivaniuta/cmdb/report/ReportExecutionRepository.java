package com.github.dimitryivaniuta.cmdb.report;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface ReportExecutionRepository extends JpaRepository<ReportExecution, Long> {

    Optional<ReportExecution> findByExecutionId(String executionId);

    Page<ReportExecution> findByReportIdOrderByStartTimeDesc(String reportId, Pageable pageable);

    @Modifying
    @Query("delete from ReportExecution e where e.retentionUntil is not null and e.retentionUntil < :now")
    int deleteExpired(@Param("now") Instant now);
}
