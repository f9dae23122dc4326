package com.github.dimitryivaniuta.cmdb.scheduler;

import java.time.Instant;

public record LockInfo(String name, String ownerId, Instant acquiredAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
