package com.github.dimitryivaniuta.cmdb.workflow;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.cmdb.error.RateLimitExceededException;
import com.github.dimitryivaniuta.cmdb.metrics.CmdbMetrics;
import com.github.dimitryivaniuta.cmdb.web.ApiProperties;
import com.github.dimitryivaniuta.cmdb.web.RequestContextKeys;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Throttles {@code POST /api/workflows/{id}/trigger} per caller. The caller is the
 * {@code X-User-Id} header when present, else the client address.
 * <p>
 * Limiters live in a bounded Caffeine cache; an evicted caller simply starts a fresh window.
 */
@Slf4j
@Component
public class TriggerRateLimiter {

    private static final Duration REFRESH_PERIOD = Duration.ofMinutes(1);

    private final ApiProperties.TriggerRateLimit cfg;
    private final CmdbMetrics metrics;
    private final Cache<String, RateLimiter> limiters;
    private final RateLimiterConfig limiterConfig;

    public TriggerRateLimiter(ApiProperties props, CmdbMetrics metrics) {
        this.cfg = props.getTriggerRateLimit();
        this.metrics = metrics;
        this.limiters = Caffeine.newBuilder()
                .maximumSize(cfg.getMaxTrackedClients())
                .expireAfterAccess(REFRESH_PERIOD.multipliedBy(10))
                .build();
        this.limiterConfig = RateLimiterConfig.custom()
                .limitForPeriod(cfg.getPermitsPerMinute())
                .limitRefreshPeriod(REFRESH_PERIOD)
                .timeoutDuration(Duration.ZERO)
                .build();
    }

    /**
     * @throws RateLimitExceededException when the caller used up its permits for the current period
     */
    public void check(HttpServletRequest request) {
        if (!cfg.isEnabled()) {
            return;
        }
        String subject = subjectOf(request);
        RateLimiter limiter = limiters.get(subject, k -> RateLimiter.of("workflow-trigger:" + k, limiterConfig));
        if (!limiter.acquirePermission()) {
            metrics.triggerRejected();
            log.warn("Workflow trigger rate limit exceeded for {}", subject);
            throw new RateLimitExceededException(
                    "Too many workflow triggers; limit is " + cfg.getPermitsPerMinute() + " per minute",
                    REFRESH_PERIOD.toSeconds());
        }
    }

    static String subjectOf(HttpServletRequest request) {
        String user = request.getHeader(RequestContextKeys.USER_ID_HEADER);
        if (user != null && !user.isBlank()) {
            return "user:" + user.trim();
        }
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return "ip:" + forwarded.split(",")[0].trim();
        }
        return "ip:" + request.getRemoteAddr();
    }
}
