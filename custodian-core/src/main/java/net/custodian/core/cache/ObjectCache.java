package net.custodian.core.cache;

import net.custodian.core.spi.ExternalCacheClient;
import net.custodian.core.spi.ExternalCacheClient.CacheRead;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * 외부 object cache 위의 {@link CacheBackend}. 모든 키는 하나의 group 에 있다.
 * key/value 클라이언트로는 prefix 삭제를 할 수 없으므로 {@link #clear(String)} 에 prefix 를 주면 false.
 */
public final class ObjectCache implements CacheBackend {
    private static final Logger log = LoggerFactory.getLogger(ObjectCache.class);

    public static final String DEFAULT_GROUP = "custodian";

    private final String group;
    private final ExternalCacheClient client;

    public ObjectCache(ExternalCacheClient client) {
        this(DEFAULT_GROUP, client);
    }

    public ObjectCache(String group, ExternalCacheClient client) {
        this.group = Objects.requireNonNull(group, "group");
        this.client = Objects.requireNonNull(client, "client");
    }

    public String group() {
        return group;
    }

    @Override
    public Lookup lookup(String key) {
        try {
            CacheRead read = client.read(group, key);
            return read != null && read.found() ? Lookup.found(read.value()) : Lookup.notFound();
        } catch (RuntimeException e) {
            log.warn("object cache read failed: group={}, key={}", group, key, e);
            return Lookup.failure();
        }
    }

    @Override
    public boolean set(String key, Object value, long ttlSeconds) {
        try {
            return client.write(group, key, value, Math.max(0, ttlSeconds));
        } catch (RuntimeException e) {
            log.warn("object cache write failed: group={}, key={}", group, key, e);
            return false;
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return client.remove(group, key);
        } catch (RuntimeException e) {
            log.warn("object cache delete failed: group={}, key={}", group, key, e);
            return false;
        }
    }

    @Override
    public boolean clear(String prefix) {
        if (prefix != null && !prefix.isEmpty()) return false;
        try {
            return client.flushGroup(group);
        } catch (RuntimeException e) {
            log.warn("object cache flush failed: group={}", group, e);
            return false;
        }
    }

    @Override
    public OptionalLong increment(String key, long delta) {
        if (!client.supportsIncrement()) return OptionalLong.empty();
        try {
            return client.incr(group, key, delta);
        } catch (RuntimeException e) {
            log.warn("object cache incr failed: group={}, key={}", group, key, e);
            return OptionalLong.empty();
        }
    }

    @Override
    public OptionalLong decrement(String key, long delta) {
        if (!client.supportsIncrement()) return OptionalLong.empty();
        try {
            OptionalLong next = client.incr(group, key, -delta);
            if (next.isPresent() && next.getAsLong() < 0) {
                // 클라이언트가 음수를 허용해도 0 으로 고정
                client.write(group, key, 0L, 0);
                return OptionalLong.of(0);
            }
            return next;
        } catch (RuntimeException e) {
            log.warn("object cache decr failed: group={}, key={}", group, key, e);
            return OptionalLong.empty();
        }
    }

    @Override
    public boolean supportsAtomicIncrement() {
        return client.supportsIncrement();
    }

    public boolean isPersistent() {
        return client.isPersistent();
    }
}
