package net.custodian.integration.spring.cache;

import net.custodian.core.spi.ExternalCacheClient;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.util.Objects;

/**
 * 스프링 {@link CacheManager} 를 외부 캐시로 사용. group 은 캐시 이름에 대응한다.
 * TTL 은 캐시 구현체 설정을 따르며 여기서 넘긴 값은 무시된다. 원자적 증감은 지원하지 않는다.
 */
public final class SpringCacheClient implements ExternalCacheClient {
    private final CacheManager cacheManager;
    private final boolean persistent;

    /** @param persistent Redis 등 프로세스 밖 저장소면 true */
    public SpringCacheClient(CacheManager cacheManager, boolean persistent) {
        this.cacheManager = Objects.requireNonNull(cacheManager, "cacheManager");
        this.persistent = persistent;
    }

    @Override
    public boolean isPersistent() {
        return persistent;
    }

    @Override
    public CacheRead read(String group, String key) {
        Cache cache = cacheManager.getCache(group);
        if (cache == null) return CacheRead.miss();
        Cache.ValueWrapper w = cache.get(key);
        return w == null ? CacheRead.miss() : CacheRead.hit(w.get());
    }

    @Override
    public boolean write(String group, String key, Object value, long ttlSeconds) {
        Cache cache = cacheManager.getCache(group);
        if (cache == null) return false;
        cache.put(key, value);
        return true;
    }

    @Override
    public boolean remove(String group, String key) {
        Cache cache = cacheManager.getCache(group);
        return cache != null && cache.evictIfPresent(key);
    }

    @Override
    public boolean flushGroup(String group) {
        Cache cache = cacheManager.getCache(group);
        if (cache == null) return false;
        cache.clear();
        return true;
    }
}
