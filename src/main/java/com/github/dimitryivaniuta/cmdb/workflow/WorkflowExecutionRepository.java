package com.github.dimitryivaniuta.cmdb.workflow;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface WorkflowExecutionRepository extends JpaRepository<WorkflowExecution, Long> {

    Optional<WorkflowExecution> findByExecutionId(String executionId);

    List<WorkflowExecution> findByWorkflowIdOrderByStartTimeDesc(String workflowId);

    long countByWorkflowId(String workflowId);

    @Query(value = """
            SELECT * FROM workflow_execution
            WHERE workflow_id = :workflowId
            ORDER BY start_time DESC, id DESC
            LIMIT :limit OFFSET :offset
            """, nativeQuery = true)
    List<WorkflowExecution> findHistory(@Param("workflowId") String workflowId,
                                        @Param("limit") int limit,
                                        @Param("offset") int offset);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from WorkflowExecution e where e.workflowId = :workflowId")
    int deleteByWorkflowId(@Param("workflowId") String workflowId);
}
