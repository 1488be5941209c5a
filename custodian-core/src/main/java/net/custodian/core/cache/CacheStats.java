package net.custodian.core.cache;

public record CacheStats(long hits, long misses, long writes, long deletes, long evictions) {
    public static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0, 0);
}
