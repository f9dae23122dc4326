package com.github.dimitryivaniuta.cmdb.resource;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Columns shared by every network resource table. The provider-assigned identifier is mapped per
 * subclass with {@link AttributeOverride} ({@code vpc_id}, {@code transit_gateway_id}, ...) and is
 * unique per region among rows where {@code deleted_at} is null.
 */
@Getter
@Setter
@MappedSuperclass
public abstract class NetworkResourceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @JsonIgnore
    @Column(name = "external_id", nullable = false, length = 64)
    private String externalId;

    @Column(name = "region", nullable = false, length = 32)
    private String region;

    @Column(name = "aws_account_id", length = 12)
    private String awsAccountId;

    @Column(name = "state", nullable = false, length = 32)
    private String state;

    @Column(name = "name", length = 255)
    private String name;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags", columnDefinition = "jsonb")
    private Map<String, String> tags;

    @Column(name = "environment", length = 50)
    private String environment;

    @Column(name = "project", length = 100)
    private String project;

    @Column(name = "cost_center", length = 100)
    private String costCenter;

    @Column(name = "owner", length = 255)
    private String owner;

    @Column(name = "source_system", length = 50)
    private String sourceSystem;

    @Column(name = "last_sync_at")
    private Instant lastSyncAt;

    @Column(name = "sync_version", nullable = false)
    private long syncVersion;

    @Column(name = "created_by", length = 128)
    private String createdBy;

    @Column(name = "updated_by", length = 128)
    private String updatedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

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

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
