package net.custodian.core.cache;

import net.custodian.core.spi.Clock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.function.Supplier;

/** 프로세스 로컬 캐시 (TTL, LRU, 적중 통계). 만료는 주입된 Clock 기준, public 메서드는 모두 synchronized */
public final class MemoryCache implements CacheBackend {
    public static final int DEFAULT_MAX_ITEMS = 1000;

    // access-order LinkedHashMap: 첫 원소가 가장 오래 전에 접근된 항목
    private final LinkedHashMap<String, Entry> storage = new LinkedHashMap<>(16, 0.75f, true);
    private final Clock clock;
    private int maxItems;

    private long hits;
    private long misses;
    private long writes;
    private long deletes;
    private long evictions;

    public MemoryCache() {
        this(DEFAULT_MAX_ITEMS, Clock.system());
    }

    public MemoryCache(int maxItems) {
        this(maxItems, Clock.system());
    }

    /** @param maxItems 0 = unbounded */
    public MemoryCache(int maxItems, Clock clock) {
        if (maxItems < 0) throw new IllegalArgumentException("maxItems must be >= 0");
        this.maxItems = maxItems;
        this.clock = clock;
    }

    @Override
    public synchronized Lookup lookup(String key) {
        Entry e = live(key);
        if (e == null) {
            misses++;
            return Lookup.notFound();
        }
        hits++;
        return Lookup.found(e.value);
    }

    @Override
    public synchronized boolean has(String key) {
        return live(key) != null;
    }

    @Override
    public synchronized boolean set(String key, Object value, long ttlSeconds) {
        Instant now = clock.now();
        if (!storage.containsKey(key)) {
            evictIfNeeded();
        }
        storage.put(key, new Entry(value, ttlSeconds > 0 ? now.plusSeconds(ttlSeconds) : null));
        writes++;
        return true;
    }

    @Override
    public synchronized boolean delete(String key) {
        if (storage.remove(key) != null) {
            deletes++;
            return true;
        }
        return false;
    }

    @Override
    public synchronized boolean clear(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            storage.clear();
            return true;
        }
        storage.keySet().removeIf(k -> k.startsWith(prefix));
        return true;
    }

    @Override
    @SuppressWarnings("unchecked")
    public synchronized <T> T remember(String key, Supplier<T> producer, long ttlSeconds) {
        Entry e = live(key);
        if (e != null) {
            hits++;
            return (T) e.value;
        }
        misses++;
        T value = producer.get();
        set(key, value, ttlSeconds);
        return value;
    }

    @Override
    public synchronized OptionalLong increment(String key, long delta) {
        return adjust(key, delta, false);
    }

    @Override
    public synchronized OptionalLong decrement(String key, long delta) {
        return adjust(key, -delta, true);
    }

    private OptionalLong adjust(String key, long delta, boolean floorAtZero) {
        Entry e = live(key);
        if (e == null) {
            long initial = floorAtZero ? Math.max(0, delta) : delta;
            set(key, initial, 0);
            return OptionalLong.of(initial);
        }
        Long current = CacheBackend.asCount(e.value);
        if (current == null) return OptionalLong.empty();

        long next = current + delta;
        if (floorAtZero && next < 0) next = 0;
        // TTL은 유지
        storage.put(key, new Entry(next, e.expiresAt));
        return OptionalLong.of(next);
    }

    @Override
    public synchronized boolean deleteMultiple(Collection<String> keys) {
        for (String key : keys) delete(key);
        return true;
    }

    // --- housekeeping ---

    /** Removes expired entries. */
    public synchronized int gc() {
        Instant now = clock.now();
        int removed = 0;
        Iterator<Entry> it = storage.values().iterator();
        while (it.hasNext()) {
            if (it.next().expired(now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /** Drops every entry and resets the counters. */
    public synchronized void flush() {
        storage.clear();
        resetStats();
    }

    public synchronized CacheStats stats() {
        return new CacheStats(hits, misses, writes, deletes, evictions);
    }

    public synchronized void resetStats() {
        hits = misses = writes = deletes = evictions = 0;
    }

    public synchronized List<String> keys() {
        return new ArrayList<>(storage.keySet());
    }

    public synchronized int size() {
        return storage.size();
    }

    public synchronized int getMaxItems() {
        return maxItems;
    }

    public synchronized void setMaxItems(int maxItems) {
        if (maxItems < 0) throw new IllegalArgumentException("maxItems must be >= 0");
        this.maxItems = maxItems;
        if (maxItems > 0) {
            while (storage.size() > maxItems) evictEldest();
        }
    }

    private Entry live(String key) {
        // access-order 맵에서 get은 접근 순서를 갱신한다 (LRU touch)
        Entry e = storage.get(key);
        if (e == null) return null;
        if (e.expired(clock.now())) {
            storage.remove(key);
            return null;
        }
        return e;
    }

    private void evictIfNeeded() {
        if (maxItems == 0 || storage.size() < maxItems) return;
        gc();
        while (storage.size() >= maxItems) evictEldest();
    }

    private void evictEldest() {
        Iterator<Map.Entry<String, Entry>> it = storage.entrySet().iterator();
        if (it.hasNext()) {
            it.next();
            it.remove();
            evictions++;
        }
    }

    private record Entry(Object value, Instant expiresAt) {
        boolean expired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
