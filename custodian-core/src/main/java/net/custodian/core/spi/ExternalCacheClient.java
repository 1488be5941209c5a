package net.custodian.core.spi;

import java.util.OptionalLong;

/** 호스트가 제공하는 외부 캐시 (group, key 단위) */
public interface ExternalCacheClient {

    /** true when values survive the current process (Redis, Memcached, ...) */
    boolean isPersistent();

    /** {@code null} value is a legal stored value, so presence comes back separately */
    CacheRead read(String group, String key);

    boolean write(String group, String key, Object value, long ttlSeconds);

    boolean remove(String group, String key);

    /** atomic add; empty if the key is missing or the stored value is not numeric */
    default OptionalLong incr(String group, String key, long delta) {
        return OptionalLong.empty();
    }

    default boolean supportsIncrement() { return false; }

    /** flush every key in {@code group}; false if the client cannot */
    default boolean flushGroup(String group) { return false; }

    record CacheRead(boolean found, Object value) {
        private static final CacheRead MISS = new CacheRead(false, null);
        public static CacheRead hit(Object value) { return new CacheRead(true, value); }
        public static CacheRead miss() { return MISS; }
    }
}
