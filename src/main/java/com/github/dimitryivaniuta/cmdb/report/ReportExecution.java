package com.github.dimitryivaniuta.cmdb.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "report_execution")
public class ReportExecution {

    @JsonIgnore
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "execution_id", nullable = false, unique = true, length = 255)
    private String executionId;

    @Column(name = "report_id", nullable = false, length = 255)
    private String reportId;

    @Column(name = "status", nullable = false, length = 16)
    private ReportExecutionStatus status;

    @Column(name = "trigger_type", nullable = false, length = 16)
    private TriggerType triggerType;

    @Column(name = "started_by", length = 128)
    private String startedBy;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "records_processed")
    private Long recordsProcessed;

    @Column(name = "output_size_bytes")
    private Long outputSizeBytes;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "execution_parameters", columnDefinition = "jsonb")
    private Map<String, Object> executionParameters;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result_summary", columnDefinition = "jsonb")
    private Map<String, Object> resultSummary;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "error_details", columnDefinition = "jsonb")
    private Map<String, Object> errorDetails;

    @Column(name = "retention_until")
    private Instant retentionUntil;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
