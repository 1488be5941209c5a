package net.custodian.core.cache;

import net.custodian.core.spi.Clock;
import net.custodian.core.spi.ExternalCacheClient;
import net.custodian.core.spi.OptionStore;
import net.custodian.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 공유 {@link CacheBackend} 선택/보관.
 * 영속 외부 캐시가 있으면 그것을, 없으면 {@link TransientCache}. 인스턴스는 composition root 에 하나.
 * {@link #setInstance(CacheBackend)} 는 초기 설정과 테스트용.
 */
public final class CacheFactory {
    private static final Logger log = LoggerFactory.getLogger(CacheFactory.class);

    public static final String DEFAULT_PREFIX = "custodian_";

    private final ExternalCacheClient externalClient;   // nullable
    private final OptionStore options;
    private final TxRunner tx;
    private final Clock clock;

    private volatile String defaultPrefix = DEFAULT_PREFIX;
    private volatile CacheBackend instance;

    public CacheFactory(ExternalCacheClient externalClient, OptionStore options, TxRunner tx, Clock clock) {
        this.externalClient = externalClient;
        this.options = Objects.requireNonNull(options, "options");
        this.tx = Objects.requireNonNull(tx, "tx");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** 외부 캐시 없이 option store 만 사용하는 구성 */
    public CacheFactory(OptionStore options, TxRunner tx) {
        this(null, options, tx, Clock.system());
    }

    public CacheBackend create() {
        return create(null);
    }

    /** @param prefix null 이면 기본 prefix */
    public CacheBackend create(String prefix) {
        String p = prefix == null ? defaultPrefix : prefix;
        if (hasPersistentCache()) {
            return new ObjectCache(p, externalClient);
        }
        return new TransientCache(p, options, tx, clock);
    }

    public CacheBackend getInstance() {
        CacheBackend current = instance;
        if (current != null) return current;
        synchronized (this) {
            if (instance == null) {
                instance = create();
                log.info("cache backend initialized: type={}, prefix={}", getBackendType(), defaultPrefix);
            }
            return instance;
        }
    }

    public synchronized void setInstance(CacheBackend backend) {
        this.instance = backend;
    }

    public synchronized void reset() {
        this.instance = null;
    }

    /** 인스턴스와 기본 prefix 모두 초기화 */
    public synchronized void resetAll() {
        this.instance = null;
        this.defaultPrefix = DEFAULT_PREFIX;
    }

    public ObjectCache createObjectCache(String group) {
        if (externalClient == null) {
            throw new IllegalStateException("no external cache client configured");
        }
        return new ObjectCache(group, externalClient);
    }

    public TransientCache createTransientCache(String prefix) {
        return new TransientCache(prefix, options, tx, clock);
    }

    public MemoryCache createMemoryCache() {
        return new MemoryCache(MemoryCache.DEFAULT_MAX_ITEMS, clock);
    }

    public MemoryCache createMemoryCache(int maxItems) {
        return new MemoryCache(maxItems, clock);
    }

    public NullCache createNullCache() {
        return new NullCache();
    }

    public void setDefaultPrefix(String prefix) {
        this.defaultPrefix = Objects.requireNonNull(prefix, "prefix");
    }

    public String getDefaultPrefix() {
        return defaultPrefix;
    }

    /** none|object|transient|memory|null|unknown. 인스턴스를 생성하지 않는다. */
    public String getBackendType() {
        CacheBackend current = instance;
        if (current == null) return "none";
        if (current instanceof ObjectCache) return "object";
        if (current instanceof TransientCache) return "transient";
        if (current instanceof MemoryCache) return "memory";
        if (current instanceof NullCache) return "null";
        return "unknown";
    }

    public boolean hasPersistentCache() {
        return externalClient != null && externalClient.isPersistent();
    }
}
