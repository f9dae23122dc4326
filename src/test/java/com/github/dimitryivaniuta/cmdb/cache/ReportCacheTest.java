package com.github.dimitryivaniuta.cmdb.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private ReportCache cache;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        cache = new ReportCache(mapper, Duration.ofMinutes(10), 100, nanos::get);
    }

    @Test
    void storesAndReturnsValues() {
        cache.set("report:vpc_inventory:a", List.of(Map.of("id", 1)));

        assertThat(cache.get("report:vpc_inventory:a")).contains(List.of(Map.of("id", 1)));
        assertThat(cache.get("report:vpc_inventory:b")).isEmpty();
    }

    @Test
    void nullValuesAreRejectedSoEmptyAlwaysMeansMiss() {
        assertThatThrownBy(() -> cache.set("report:vpc_inventory:n", null))
                .isInstanceOf(NullPointerException.class);

        assertThat(cache.get("report:vpc_inventory:n")).isEmpty();
        assertThat(cache.getStats().entries()).isZero();
    }

    @Test
    void entriesExpireAfterTheirOwnTtl() {
        cache.set("short", "s", Duration.ofSeconds(30));
        cache.set("default", "d");

        advance(Duration.ofSeconds(31));
        assertThat(cache.get("short")).isEmpty();
        assertThat(cache.get("default")).contains("d");

        advance(Duration.ofMinutes(10));
        assertThat(cache.get("default")).isEmpty();
    }

    @Test
    void nonPositiveTtlFallsBackToDefault() {
        cache.set("k", "v", Duration.ZERO);

        advance(Duration.ofMinutes(9));
        assertThat(cache.get("k")).contains("v");
    }

    @Test
    void patternInvalidationRemovesOnlyMatchingKeys() {
        cache.set("report:vpc_inventory:1", 1);
        cache.set("report:vpc_inventory:2", 2);
        cache.set("report:resource_summary:1", 3);

        int removed = cache.invalidate("report:vpc_inventory:*");

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("report:vpc_inventory:1")).isEmpty();
        assertThat(cache.get("report:resource_summary:1")).contains(3);
    }

    @Test
    void patternWithoutWildcardRemovesExactKey() {
        cache.set("report:a:1", 1);
        cache.set("report:a:10", 2);

        assertThat(cache.invalidate("report:a:1")).isEqualTo(1);
        assertThat(cache.get("report:a:10")).contains(2);
        assertThat(cache.invalidate("report:a:1")).isZero();
    }

    @Test
    void statsTrackHitsMissesAndInvalidations() {
        cache.set("k", "v");
        cache.get("k");
        cache.get("k");
        cache.get("missing");
        cache.invalidate("k");

        CacheStats stats = cache.getStats();

        assertThat(stats.hits()).isEqualTo(2);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRatio()).isEqualTo(2.0 / 3.0);
        assertThat(stats.entries()).isZero();
        assertThat(stats.invalidations()).isEqualTo(1);
        assertThat(stats.maxEntries()).isEqualTo(100);
    }

    @Test
    void keyIgnoresArgumentOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("region", "us-east-1");
        first.put("state", "available");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("state", "available");
        second.put("region", "us-east-1");

        String key = cache.key("vpc_inventory", first);

        assertThat(key).startsWith("report:vpc_inventory:").isEqualTo(cache.key("vpc_inventory", second));
        assertThat(key).isNotEqualTo(cache.key("vpc_inventory", Map.of("region", "eu-west-1")));
    }

    @Test
    void globTranslationQuotesLiterals() {
        assertThat(ReportCache.globToRegex("report:a.b:*").matcher("report:a.b:xyz").matches()).isTrue();
        assertThat(ReportCache.globToRegex("report:a.b:*").matcher("report:aXb:xyz").matches()).isFalse();
        assertThat(ReportCache.globToRegex("report:?:1").matcher("report:q:1").matches()).isTrue();
    }

    private void advance(Duration d) {
        nanos.addAndGet(d.toNanos());
    }
}
