package com.github.dimitryivaniuta.cmdb.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryJobLockTest {

    private MutableClock clock;
    private InMemoryJobLock lock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        lock = new InMemoryJobLock("node-a", clock);
    }

    @Test
    void secondAcquireFailsEvenForTheSameOwner() {
        assertThat(lock.acquireLock("workflow-polling", Duration.ofMinutes(5))).isTrue();
        assertThat(lock.acquireLock("workflow-polling", Duration.ofMinutes(5))).isFalse();
        assertThat(lock.isLocked("workflow-polling")).isTrue();
    }

    @Test
    void expiredLockCanBeTakenOver() {
        lock.acquireLock("workflow-polling", Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(5));

        assertThat(lock.isLocked("workflow-polling")).isFalse();
        assertThat(lock.acquireLock("workflow-polling", Duration.ofMinutes(1))).isTrue();
        assertThat(lock.getLockInfo("workflow-polling"))
                .hasValueSatisfying(info -> assertThat(info.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(1))));
    }

    @Test
    void onlyTheOwnerReleases() {
        InMemoryJobLock other = new InMemoryJobLock("node-b", clock);
        lock.acquireLock("report", Duration.ofMinutes(1));

        assertThat(other.releaseLock("report")).isFalse();
        assertThat(lock.releaseLock("report")).isTrue();
        assertThat(lock.releaseLock("report")).isFalse();
    }

    @Test
    void cleanupRemovesOnlyExpiredLocks() {
        lock.acquireLock("short", Duration.ofSeconds(30));
        lock.acquireLock("long", Duration.ofMinutes(10));
        clock.advance(Duration.ofMinutes(1));

        assertThat(lock.cleanupExpired()).isEqualTo(1);
        assertThat(lock.getActiveLocks()).extracting(LockInfo::name).containsExactly("long");
        assertThat(lock.ownerId()).isEqualTo("node-a");
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
