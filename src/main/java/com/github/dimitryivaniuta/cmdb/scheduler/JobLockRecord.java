package com.github.dimitryivaniuta.cmdb.scheduler;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "job_lock")
public class JobLockRecord {

    @Id
    @Column(name = "lock_name", length = 128)
    private String lockName;

    @Column(name = "owner_id", nullable = false, length = 255)
    private String ownerId;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    LockInfo toInfo() {
        return new LockInfo(lockName, ownerId, acquiredAt, expiresAt);
    }
}
