package com.github.dimitryivaniuta.cmdb.workflow;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface WorkflowAlertRepository extends JpaRepository<WorkflowAlert, Long> {

    List<WorkflowAlert> findByExecutionIdOrderByCreatedAtAsc(String executionId);

    /**
     * @return 1 when the alert was created, 0 when one of this type already exists for the execution
     */
    @Modifying
    @Query(value = """
            INSERT INTO workflow_alert (execution_id, alert_type, recipients, created_at)
            VALUES (:executionId, :alertType, :recipients, :now)
            ON CONFLICT (execution_id, alert_type) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("executionId") String executionId,
                       @Param("alertType") String alertType,
                       @Param("recipients") String recipients,
                       @Param("now") Instant now);
}
