package com.github.dimitryivaniuta.cmdb.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "report_definition")
public class ReportDefinition {

    @JsonIgnore
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "report_id", nullable = false, unique = true, length = 255)
    private String reportId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "report_type", nullable = false, length = 64)
    private ReportType reportType;

    @Column(name = "category", nullable = false, length = 32)
    private ReportCategory category;

    @Column(name = "provider", nullable = false, length = 32)
    private CloudProvider provider;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "query_config", nullable = false, columnDefinition = "jsonb")
    private QueryConfig queryConfig;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "scheduling_config", columnDefinition = "jsonb")
    private ScheduleConfig schedulingConfig;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "notification_config", columnDefinition = "jsonb")
    private NotificationConfig notificationConfig;

    @JsonProperty("isActive")
    @Column(name = "is_active", nullable = false)
    private boolean active;

    @JsonProperty("isPublic")
    @Column(name = "is_public", nullable = false)
    private boolean publicReport;

    @Column(name = "created_by", nullable = false, length = 128)
    private String createdBy;

    @Column(name = "last_modified_by", nullable = false, length = 128)
    private String lastModifiedBy;

    @Column(name = "version", nullable = false)
    private int version;

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
