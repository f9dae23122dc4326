package com.github.dimitryivaniuta.cmdb.workflow;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface WorkflowRegistryRepository extends JpaRepository<WorkflowRegistryEntry, Long> {

    Optional<WorkflowRegistryEntry> findByWorkflowId(String workflowId);

    List<WorkflowRegistryEntry> findByActiveTrueOrderByWorkflowIdAsc();

    List<WorkflowRegistryEntry> findAllByOrderByWorkflowIdAsc();

    long countByActiveTrue();

    @Query("""
            select w from WorkflowRegistryEntry w
            where (:provider is null or w.provider = :provider)
              and (:type is null or w.workflowType = :type)
              and (:active is null or w.active = :active)
            """)
    Page<WorkflowRegistryEntry> search(@Param("provider") WorkflowProvider provider,
                                       @Param("type") WorkflowType type,
                                       @Param("active") Boolean active,
                                       Pageable pageable);
}
