package com.github.dimitryivaniuta.cmdb.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.AbstractCacheManager;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Caffeine CacheManager with the TTL encoded in the cache name:
 *
 *   "reportDefinitions:ttl=60"   -> expireAfterWrite 60 seconds
 *   "workflowRegistry"           -> base builder settings
 *
 * Caches are created lazily. Caffeine builders are mutable, so a fresh one is requested from the
 * factory for every cache.
 */
public final class TtlCaffeineCacheManager extends AbstractCacheManager {

    private static final Pattern TTL_SUFFIX = Pattern.compile("^(?<base>.+?):ttl=(?<ttl>\\d{1,9})$");
    private static final long MIN_TTL_SECONDS = 1;
    private static final long MAX_TTL_SECONDS = Duration.ofHours(24).toSeconds();

    private final Supplier<Caffeine<Object, Object>> builderFactory;
    private final Map<String, Cache> caches = new ConcurrentHashMap<>();

    public TtlCaffeineCacheManager(Supplier<Caffeine<Object, Object>> builderFactory) {
        this.builderFactory = Objects.requireNonNull(builderFactory, "builderFactory must not be null");
    }

    @Override
    protected Collection<? extends Cache> loadCaches() {
        return List.of();
    }

    @Override
    protected Cache getMissingCache(String name) {
        return caches.computeIfAbsent(name, this::create);
    }

    private Cache create(String name) {
        Caffeine<Object, Object> builder = builderFactory.get();
        Duration ttl = ttlOf(name);
        if (ttl != null) {
            builder = builder.expireAfterWrite(ttl);
        }
        // full name, so the same base with different TTLs stays separate
        return new CaffeineCache(name, builder.build());
    }

    /** TTL parsed from the ":ttl=N" suffix and clamped to [1s, 24h]; null when absent. */
    static Duration ttlOf(String name) {
        if (name == null) {
            return null;
        }
        Matcher m = TTL_SUFFIX.matcher(name.trim());
        if (!m.matches()) {
            return null;
        }
        long seconds = Long.parseLong(m.group("ttl"));
        return Duration.ofSeconds(Math.max(MIN_TTL_SECONDS, Math.min(seconds, MAX_TTL_SECONDS)));
    }
}
