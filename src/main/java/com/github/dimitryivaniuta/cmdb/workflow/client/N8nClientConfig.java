package com.github.dimitryivaniuta.cmdb.workflow.client;

import com.github.dimitryivaniuta.cmdb.metrics.CmdbMetrics;
import com.github.dimitryivaniuta.cmdb.workflow.ratelimit.JdbcSlidingWindowRateLimiter;
import com.github.dimitryivaniuta.cmdb.workflow.ratelimit.RequestRateLimiter;
import com.github.dimitryivaniuta.cmdb.workflow.ratelimit.SlidingWindowRateLimiter;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;

/**
 * OkHttp client for the workflow engine.
 * Interceptor order: rate-limit gate, credentials, timing.
 */
@Configuration
public class N8nClientConfig {

    @Bean
    public RequestRateLimiter n8nRateLimiter(N8nProperties props,
                                             Clock clock,
                                             JdbcTemplate jdbc,
                                             PlatformTransactionManager txManager) {
        int max = props.getRateLimit().getMaxRequestsPerMinute();
        if ("jdbc".equals(props.getRateLimit().getStore())) {
            return new JdbcSlidingWindowRateLimiter("n8n", max, SlidingWindowRateLimiter.DEFAULT_WINDOW,
                    clock, jdbc, txManager);
        }
        return new SlidingWindowRateLimiter(max, clock);
    }

    @Bean
    public OkHttpClient n8nHttpClient(N8nProperties props,
                                      RequestRateLimiter n8nRateLimiter,
                                      Clock clock,
                                      CmdbMetrics metrics) {
        Duration timeout = Duration.ofMillis(props.getTimeoutMs());
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .retryOnConnectionFailure(false)
                .addInterceptor(new RateLimitInterceptor(n8nRateLimiter, clock, d -> Thread.sleep(d.toMillis()), metrics))
                .addInterceptor(new ApiKeyHeaderInterceptor(props.getApiKey(), props.getUserAgent()))
                .addInterceptor(new CallTimingInterceptor(metrics, props.isLoggingEnabled()))
                .build();
    }
}
