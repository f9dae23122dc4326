package com.github.dimitryivaniuta.cmdb.workflow.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlidingWindowRateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

    @Test
    void grantsUpToMaxRequestsPerWindow() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(3, clock);

        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isFalse();
        assertThat(limiter.getCurrentRequests()).isEqualTo(3);
        assertThat(limiter.canMakeRequest()).isFalse();
    }

    @Test
    void slotsFreeUpOnceTheOldestRequestLeavesTheWindow() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(2, clock);
        limiter.recordRequest();
        clock.advance(Duration.ofSeconds(20));
        limiter.recordRequest();

        assertThat(limiter.getResetTime()).isEqualTo(Instant.parse("2024-05-01T10:01:00Z"));

        clock.advance(Duration.ofSeconds(39));
        assertThat(limiter.canMakeRequest()).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(limiter.canMakeRequest()).isTrue();
        assertThat(limiter.getCurrentRequests()).isEqualTo(1);
    }

    @Test
    void resetTimeIsNowWhenEmpty() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(5, clock);

        assertThat(limiter.getResetTime()).isEqualTo(clock.instant());
        assertThat(limiter.getMaxRequests()).isEqualTo(5);
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> new SlidingWindowRateLimiter(0, clock))
                .isInstanceOf(IllegalArgumentException.class);
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
