package net.custodian.core.cache;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * 캐시 백엔드 공통 계약.
 * TTL 은 초 단위, 0 이하는 만료 없음. 존재 여부는 {@link #lookup(String)}/{@link #has(String)} 로만 판단한다.
 */
public interface CacheBackend {

    Lookup lookup(String key);

    default Object get(String key) {
        return get(key, null);
    }

    default Object get(String key, Object defaultValue) {
        return lookup(key).orElse(defaultValue);
    }

    boolean set(String key, Object value, long ttlSeconds);

    default boolean set(String key, Object value) {
        return set(key, value, 0);
    }

    boolean delete(String key);

    default boolean has(String key) {
        return lookup(key).found();
    }

    /** 빈 prefix = 전체 삭제. 백엔드가 지원하지 않으면 false (부분 삭제는 하지 않는다) */
    boolean clear(String prefix);

    default boolean clear() {
        return clear("");
    }

    /**
     * Returns the cached value, or computes it with {@code producer}, stores it and returns it.
     * Exceptions thrown by {@code producer} propagate and nothing is stored.
     */
    @SuppressWarnings("unchecked")
    default <T> T remember(String key, Supplier<T> producer, long ttlSeconds) {
        Lookup hit = lookup(key);
        if (hit.found()) return (T) hit.value();
        T value = producer.get();
        set(key, value, ttlSeconds);
        return value;
    }

    /** empty when the stored value is not numeric (or the backend cannot count) */
    OptionalLong increment(String key, long delta);

    default OptionalLong increment(String key) {
        return increment(key, 1);
    }

    /** never goes below zero */
    OptionalLong decrement(String key, long delta);

    default OptionalLong decrement(String key) {
        return decrement(key, 1);
    }

    /** true when {@link #increment} is a single atomic backend operation */
    default boolean supportsAtomicIncrement() {
        return false;
    }

    default Map<String, Object> getMultiple(Collection<String> keys, Object defaultValue) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String key : keys) {
            out.put(key, get(key, defaultValue));
        }
        return out;
    }

    default boolean setMultiple(Map<String, ?> values, long ttlSeconds) {
        boolean ok = true;
        for (Map.Entry<String, ?> e : values.entrySet()) {
            if (!set(e.getKey(), e.getValue(), ttlSeconds)) ok = false;
        }
        return ok;
    }

    default boolean deleteMultiple(Collection<String> keys) {
        boolean ok = true;
        for (String key : keys) {
            if (!delete(key)) ok = false;
        }
        return ok;
    }

    /** Numeric view of a stored value, or null if it is not a whole number. */
    static Long asCount(Object value) {
        if (value instanceof Long l) return l;
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d == Math.rint(d) && !Double.isInfinite(d) ? (long) d : null;
        }
        if (value instanceof String s) {
            try { return Long.parseLong(s.trim()); } catch (NumberFormatException e) { return null; }
        }
        return null;
    }
}
