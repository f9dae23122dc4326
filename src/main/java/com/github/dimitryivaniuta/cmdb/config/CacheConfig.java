package com.github.dimitryivaniuta.cmdb.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.dimitryivaniuta.cmdb.cache.ReportCache;
import com.github.dimitryivaniuta.cmdb.cache.TtlCaffeineCacheManager;
import com.github.dimitryivaniuta.cmdb.report.ReportProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Spring cache abstraction backed by local Caffeine caches.
 * TTL per cache via name convention: "reportDefinitions:ttl=60".
 * <p>
 * Report query results do not go through here; they live in {@link ReportCache}, which needs
 * per-entry TTL and pattern invalidation.
 */
@Configuration
public class CacheConfig {

    @Bean
    public CacheManager cacheManager() {
        return new TtlCaffeineCacheManager(() ->
                Caffeine.newBuilder()
                        .maximumSize(5_000)
                        .expireAfterAccess(Duration.ofMinutes(10))
                        .recordStats()
        );
    }

    @Bean
    public ReportCache reportCache(ObjectMapper objectMapper, ReportProperties props) {
        ReportProperties.Cache c = props.getCache();
        return new ReportCache(objectMapper, c.getDefaultTtl(), c.getMaxEntries(), Ticker.systemTicker());
    }
}
