package com.github.dimitryivaniuta.cmdb.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Single-process lock store. */
@Slf4j
public class InMemoryJobLock implements JobLock {

    private final ConcurrentHashMap<String, LockInfo> locks = new ConcurrentHashMap<>();
    private final String ownerId;
    private final Clock clock;

    public InMemoryJobLock(String ownerId, Clock clock) {
        this.ownerId = ownerId;
        this.clock = clock;
    }

    @Override
    public boolean acquireLock(String name, Duration ttl) {
        Instant now = clock.instant();
        LockInfo candidate = new LockInfo(name, ownerId, now, now.plus(ttl));
        LockInfo result = locks.compute(name, (k, current) ->
                current == null || current.isExpired(now) ? candidate : current);
        boolean acquired = result == candidate;
        if (acquired) {
            log.debug("Lock {} acquired until {}", name, candidate.expiresAt());
        }
        return acquired;
    }

    @Override
    public boolean releaseLock(String name) {
        LockInfo current = locks.get(name);
        if (current == null || !ownerId.equals(current.ownerId())) {
            return false;
        }
        return locks.remove(name, current);
    }

    @Override
    public boolean isLocked(String name) {
        return getLockInfo(name).isPresent();
    }

    @Override
    public Optional<LockInfo> getLockInfo(String name) {
        Instant now = clock.instant();
        return Optional.ofNullable(locks.get(name)).filter(l -> !l.isExpired(now));
    }

    @Override
    public List<LockInfo> getActiveLocks() {
        Instant now = clock.instant();
        return locks.values().stream()
                .filter(l -> !l.isExpired(now))
                .sorted(Comparator.comparing(LockInfo::name))
                .toList();
    }

    @Override
    public int cleanupExpired() {
        Instant now = clock.instant();
        int[] removed = {0};
        locks.forEach((name, lock) -> {
            if (lock.isExpired(now) && locks.remove(name, lock)) {
                removed[0]++;
            }
        });
        return removed[0];
    }

    @Override
    public String ownerId() {
        return ownerId;
    }
}
