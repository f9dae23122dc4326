package com.github.dimitryivaniuta.cmdb.workflow;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One alert per (execution, alert type); the pair is unique in the table.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "workflow_alert")
public class WorkflowAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "execution_id", nullable = false, length = 255)
    private String executionId;

    @Column(name = "alert_type", nullable = false, length = 32)
    private AlertType alertType;

    @Column(name = "recipients", nullable = false, columnDefinition = "text")
    private String recipients;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
