package net.cratedigger.support.cache;

/**
 * Point-in-time counters for a {@link BoundedCache}.
 *
 * @param name cache name used in logs
 * @param size live entries, including expired entries not yet swept
 * @param maxSize configured capacity
 * @param hits lookups served from a live entry
 * @param misses lookups that found nothing usable
 * @param evictions entries dropped to respect {@code maxSize}
 * @param hitRate {@code hits / (hits + misses)}, or {@code 0} before any lookup
 * @param approxMemoryBytes rough footprint estimate, only good for dashboards
 */
public record CacheStatistics(
    String name,
    int size,
    int maxSize,
    long hits,
    long misses,
    long evictions,
    double hitRate,
    long approxMemoryBytes
) {
}
