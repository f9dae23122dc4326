package com.github.dimitryivaniuta.cmdb.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.dimitryivaniuta.cmdb.support.HashingSupport;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Report result cache with a TTL per entry.
 * <p>
 * Keys look like {@code report:<queryName>:<sha256>}, the hash taken over the canonical JSON of the
 * query arguments, so argument order does not change the key. Concurrent misses on one key are not
 * coalesced.
 */
@Slf4j
public class ReportCache {

    public static final String KEY_PREFIX = "report:";

    private final Cache<String, Entry> cache;
    private final ObjectMapper objectMapper;
    private final Duration defaultTtl;
    private final long maxEntries;
    private final AtomicLong invalidations = new AtomicLong();

    public ReportCache(ObjectMapper objectMapper, Duration defaultTtl, long maxEntries, Ticker ticker) {
        this.objectMapper = objectMapper;
        this.defaultTtl = defaultTtl;
        this.maxEntries = maxEntries;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    /** Empty on a miss. Values are never null, so an empty result always means a miss. */
    public Optional<Object> get(String key) {
        Entry e = cache.getIfPresent(key);
        return e == null ? Optional.empty() : Optional.of(e.value());
    }

    public void set(String key, Object value) {
        set(key, value, defaultTtl);
    }

    /**
     * @throws NullPointerException when {@code value} is null
     */
    public void set(String key, Object value, Duration ttl) {
        Objects.requireNonNull(value, "Report cache does not store null values");
        Duration effective = (ttl == null || ttl.isZero() || ttl.isNegative()) ? defaultTtl : ttl;
        cache.put(key, new Entry(value, effective));
    }

    /**
     * Removes every key matching a glob ({@code *} any run, {@code ?} one character); a pattern
     * without wildcards removes that exact key.
     *
     * @return number of entries removed
     */
    public int invalidate(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return 0;
        }
        List<String> matched = new ArrayList<>();
        if (pattern.indexOf('*') < 0 && pattern.indexOf('?') < 0) {
            if (cache.asMap().containsKey(pattern)) {
                matched.add(pattern);
            }
        } else {
            Pattern regex = globToRegex(pattern);
            for (String key : cache.asMap().keySet()) {
                if (regex.matcher(key).matches()) {
                    matched.add(key);
                }
            }
        }
        cache.invalidateAll(matched);
        invalidations.addAndGet(matched.size());
        if (!matched.isEmpty()) {
            log.debug("Report cache invalidated {} entries for pattern {}", matched.size(), pattern);
        }
        return matched.size();
    }

    public void clear() {
        long size = cache.estimatedSize();
        cache.invalidateAll();
        invalidations.addAndGet(size);
    }

    public CacheStats getStats() {
        cache.cleanUp();
        com.github.benmanes.caffeine.cache.stats.CacheStats s = cache.stats();
        long total = s.hitCount() + s.missCount();
        double ratio = total == 0 ? 0.0 : (double) s.hitCount() / total;
        return new CacheStats(s.hitCount(), s.missCount(), ratio, cache.estimatedSize(), invalidations.get(), maxEntries);
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public String key(String queryName, Object arguments) {
        try {
            String canonical = objectMapper.writeValueAsString(arguments);
            return KEY_PREFIX + queryName + ":" + HashingSupport.sha256Hex(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Query arguments are not serializable for " + queryName, e);
        }
    }

    static Pattern globToRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            sb.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(sb.toString());
    }

    private record Entry(Object value, Duration ttl) {
    }

    private static final class PerEntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
