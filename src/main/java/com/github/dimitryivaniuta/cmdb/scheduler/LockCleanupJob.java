package com.github.dimitryivaniuta.cmdb.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes expired job locks (expires_at <= now).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LockCleanupJob {

    private final JobLock lock;

    @Scheduled(fixedDelayString = "${cmdb.scheduler.lock.cleanup-interval:PT30M}",
            initialDelayString = "${cmdb.scheduler.lock.cleanup-interval:PT30M}")
    public void cleanupExpired() {
        int removed = lock.cleanupExpired();
        if (removed > 0) {
            log.info("Job lock cleanup removed {} expired locks", removed);
        }
    }
}
