package net.custodian.core.ratelimit;

import net.custodian.core.cache.CacheBackend;
import net.custodian.core.cache.Lookup;
import net.custodian.core.cache.TransientCache;
import net.custodian.core.spi.SettingsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * 호출자별 고정 윈도우({@value #WINDOW_SECONDS}초) 요청 제한.
 * - 공유 캐시가 원자적 증가를 지원하면 카운터는 캐시에 둔다
 * - 아니면 {@link TransientCache} 에 두고 읽기-검사-쓰기를 {@link OptionLock} 으로 직렬화
 * 락 획득 실패나 카운터 읽기/쓰기 오류는 모두 {@link RateLimitDecision#UNAVAILABLE} (fail-closed).
 */
public final class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public static final int DEFAULT_LIMIT = 60;
    public static final long WINDOW_SECONDS = 60;

    static final String COUNTER_KEY = "rate_limit_";
    static final String LOCK_KEY = "rl_lock_";

    private final CacheBackend cache;
    private final TransientCache fallbackCounters;
    private final OptionLock lock;
    private final SettingsProvider settings;
    private final String lockPrefix;

    /**
     * @param cache            shared cache; used only when it supports atomic increment
     * @param fallbackCounters counter storage for the locked path
     * @param lock             per-caller lock for the locked path
     */
    public RateLimiter(CacheBackend cache, TransientCache fallbackCounters, OptionLock lock, SettingsProvider settings) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.fallbackCounters = Objects.requireNonNull(fallbackCounters, "fallbackCounters");
        this.lock = Objects.requireNonNull(lock, "lock");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.lockPrefix = fallbackCounters.prefix() + LOCK_KEY;
    }

    /** 현재 설정된 분당 허용 요청 수 */
    public int limit() {
        int limit = settings.getInt(SettingsProvider.RATE_LIMIT, DEFAULT_LIMIT);
        return limit > 0 ? limit : DEFAULT_LIMIT;
    }

    /** 빈 callerId(익명)는 제한하지 않는다 */
    public RateLimitDecision check(String callerId) {
        if (callerId == null || callerId.isBlank()) return RateLimitDecision.ALLOWED;
        int limit = limit();
        String counterKey = COUNTER_KEY + callerId;
        RateLimitDecision decision = cache.supportsAtomicIncrement()
                ? checkAtomic(counterKey, limit)
                : checkWithLock(callerId, counterKey, limit);
        if (!decision.allowed()) {
            log.debug("rate limit {}: caller={}, limit={}", decision, callerId, limit);
        }
        return decision;
    }

    /**
     * incr 결과가 empty 이면 "키 없음" 과 "저장소 오류" 를 구분할 수 없으므로 직접 조회한다.
     * 읽기/쓰기 오류는 모두 UNAVAILABLE: 새 윈도우로 오인하면 카운터가 1 로 초기화된다.
     */
    private RateLimitDecision checkAtomic(String counterKey, int limit) {
        OptionalLong count = cache.increment(counterKey, 1);
        if (count.isEmpty()) {
            Lookup current = cache.lookup(counterKey);
            if (current.failed()) return unavailable(counterKey);
            if (current.found()) {
                // 조회 사이에 다른 요청이 윈도우를 열었을 수 있다. 한 번만 다시 시도
                count = cache.increment(counterKey, 1);
                if (count.isEmpty()) return unavailable(counterKey);
            } else {
                if (!cache.set(counterKey, 1L, WINDOW_SECONDS)) return unavailable(counterKey);
                return RateLimitDecision.ALLOWED;
            }
        }
        return count.getAsLong() > limit ? RateLimitDecision.EXCEEDED : RateLimitDecision.ALLOWED;
    }

    private RateLimitDecision checkWithLock(String callerId, String counterKey, int limit) {
        String lockKey = lockPrefix + callerId;
        try {
            if (!lock.acquire(lockKey)) {
                log.warn("rate limiter lock unavailable: caller={}", callerId);
                return RateLimitDecision.UNAVAILABLE;
            }
        } catch (Exception e) {
            log.warn("rate limiter lock failed: caller={}", callerId, e);
            return RateLimitDecision.UNAVAILABLE;
        }

        try {
            Lookup current = fallbackCounters.lookup(counterKey);
            if (current.failed()) return unavailable(counterKey);
            long used = 0;
            if (current.found()) {
                Long requests = CacheBackend.asCount(current.value());
                used = requests == null ? 0 : requests;
                if (used >= limit) return RateLimitDecision.EXCEEDED;
            }
            if (!fallbackCounters.set(counterKey, used + 1, WINDOW_SECONDS)) return unavailable(counterKey);
            return RateLimitDecision.ALLOWED;
        } finally {
            try {
                lock.release(lockKey);
            } catch (Exception e) {
                // 해제 실패 시 락은 TTL 경과 후 다음 호출자가 정리한다
                log.warn("rate limiter lock release failed: caller={}", callerId, e);
            }
        }
    }

    private static RateLimitDecision unavailable(String counterKey) {
        log.warn("rate limit counter unavailable, request refused: key={}", counterKey);
        return RateLimitDecision.UNAVAILABLE;
    }
}
