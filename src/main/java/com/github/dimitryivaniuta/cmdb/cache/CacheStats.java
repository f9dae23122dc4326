package com.github.dimitryivaniuta.cmdb.cache;

public record CacheStats(
        long hits,
        long misses,
        double hitRatio,
        long entries,
        long invalidations,
        long maxEntries
) {
}
