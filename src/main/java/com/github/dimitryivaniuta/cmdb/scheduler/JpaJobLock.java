package com.github.dimitryivaniuta.cmdb.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Lock store shared by every instance through the {@code job_lock} table. Acquisition is a single
 * upsert, so two instances racing for a free or expired lock cannot both win.
 */
@Slf4j
public class JpaJobLock implements JobLock {

    private final JobLockRepository repo;
    private final String ownerId;
    private final Clock clock;

    public JpaJobLock(JobLockRepository repo, String ownerId, Clock clock) {
        this.repo = repo;
        this.ownerId = ownerId;
        this.clock = clock;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean acquireLock(String name, Duration ttl) {
        Instant now = clock.instant();
        boolean acquired = repo.tryAcquire(name, ownerId, now, now.plus(ttl)) > 0;
        if (acquired) {
            log.debug("Lock {} acquired by {} until {}", name, ownerId, now.plus(ttl));
        }
        return acquired;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean releaseLock(String name) {
        return repo.release(name, ownerId) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isLocked(String name) {
        return getLockInfo(name).isPresent();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LockInfo> getLockInfo(String name) {
        Instant now = clock.instant();
        return repo.findById(name)
                .map(JobLockRecord::toInfo)
                .filter(l -> !l.isExpired(now));
    }

    @Override
    @Transactional(readOnly = true)
    public List<LockInfo> getActiveLocks() {
        return repo.findByExpiresAtAfterOrderByLockNameAsc(clock.instant()).stream()
                .map(JobLockRecord::toInfo)
                .toList();
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int cleanupExpired() {
        return repo.deleteExpired(clock.instant());
    }

    @Override
    public String ownerId() {
        return ownerId;
    }
}
