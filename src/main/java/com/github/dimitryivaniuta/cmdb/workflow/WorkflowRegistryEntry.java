package com.github.dimitryivaniuta.cmdb.workflow;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "workflow_registry")
public class WorkflowRegistryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Engine-side workflow id. */
    @Column(name = "workflow_id", nullable = false, unique = true, length = 255)
    private String workflowId;

    @Column(name = "workflow_name", nullable = false, length = 255)
    private String name;

    @Column(name = "workflow_type", nullable = false, length = 32)
    private WorkflowType workflowType;

    @Column(name = "provider", nullable = false, length = 32)
    private WorkflowProvider provider;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }
}
