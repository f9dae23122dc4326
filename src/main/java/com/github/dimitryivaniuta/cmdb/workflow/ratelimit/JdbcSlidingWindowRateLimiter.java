package com.github.dimitryivaniuta.cmdb.workflow.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Limiter shared by all instances through the {@code rate_limit_hit} table. Check-and-record runs
 * under a transaction-scoped advisory lock keyed by the limiter name.
 */
@Slf4j
public class JdbcSlidingWindowRateLimiter implements RequestRateLimiter {

    private final String name;
    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    public JdbcSlidingWindowRateLimiter(String name, int maxRequests, Duration window, Clock clock,
                                        JdbcTemplate jdbc, PlatformTransactionManager txManager) {
        this.name = name;
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
        this.jdbc = jdbc;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public boolean canMakeRequest() {
        return getCurrentRequests() < maxRequests;
    }

    @Override
    public void recordRequest() {
        tx.executeWithoutResult(status -> insertHit(clock.instant()));
    }

    @Override
    public Instant getResetTime() {
        Instant now = clock.instant();
        Timestamp oldest = jdbc.queryForObject(
                "SELECT min(hit_at) FROM rate_limit_hit WHERE limiter_name = ? AND hit_at > ?",
                Timestamp.class, name, Timestamp.from(now.minus(window)));
        return oldest == null ? now : oldest.toInstant().plus(window);
    }

    @Override
    public int getCurrentRequests() {
        Integer count = jdbc.queryForObject(
                "SELECT count(*) FROM rate_limit_hit WHERE limiter_name = ? AND hit_at > ?",
                Integer.class, name, Timestamp.from(clock.instant().minus(window)));
        return count == null ? 0 : count;
    }

    @Override
    public int getMaxRequests() {
        return maxRequests;
    }

    @Override
    public boolean tryAcquire() {
        Boolean acquired = tx.execute(status -> {
            jdbc.queryForList("SELECT pg_advisory_xact_lock(hashtext(?))", name);
            Instant now = clock.instant();
            Timestamp cutoff = Timestamp.from(now.minus(window));
            jdbc.update("DELETE FROM rate_limit_hit WHERE limiter_name = ? AND hit_at <= ?", name, cutoff);
            Integer inWindow = jdbc.queryForObject(
                    "SELECT count(*) FROM rate_limit_hit WHERE limiter_name = ?", Integer.class, name);
            if (inWindow != null && inWindow >= maxRequests) {
                return false;
            }
            insertHit(now);
            return true;
        });
        if (!Boolean.TRUE.equals(acquired)) {
            log.debug("Shared rate limiter {} is full ({} per {})", name, maxRequests, window);
            return false;
        }
        return true;
    }

    private void insertHit(Instant at) {
        jdbc.update("INSERT INTO rate_limit_hit (limiter_name, hit_at) VALUES (?, ?)", name, Timestamp.from(at));
    }
}
