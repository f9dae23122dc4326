package com.github.dimitryivaniuta.cmdb.scheduler;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Named mutual-exclusion lock with a TTL. Not re-entrant: a second acquire of a held lock fails
 * even for the same owner. An expired lock can be taken over by anyone.
 */
public interface JobLock {

    boolean acquireLock(String name, Duration ttl);

    /** Releases the lock if this instance owns it. */
    boolean releaseLock(String name);

    boolean isLocked(String name);

    Optional<LockInfo> getLockInfo(String name);

    List<LockInfo> getActiveLocks();

    /** @return number of expired locks removed */
    int cleanupExpired();

    String ownerId();
}
