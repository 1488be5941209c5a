package net.custodian.core.ratelimit;

import net.custodian.core.cache.TransientCache;
import net.custodian.core.service.RetryPolicy;
import net.custodian.core.spi.Clock;
import net.custodian.core.spi.OptionStore;
import net.custodian.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 옵션 이름의 유일성을 이용한 단기 상호 배제.
 * 락 행과 timeout 행을 한 문장으로 넣고, 두 행을 모두 넣은 호출자만 락을 가진다.
 * 보유자가 죽으면 timeout 이 지난 뒤 다음 호출자가 정리하고 한 번 더 시도한다.
 */
public final class OptionLock {
    private static final Logger log = LoggerFactory.getLogger(OptionLock.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_BACKOFF = Duration.ofMillis(50);

    private final OptionStore options;
    private final TxRunner tx;
    private final Clock clock;
    private final Duration ttl;
    private final int maxAttempts;
    private final RetryPolicy retry;

    public OptionLock(OptionStore options, TxRunner tx, Clock clock) {
        this(options, tx, clock, DEFAULT_TTL, DEFAULT_MAX_ATTEMPTS, RetryPolicy.fixed(DEFAULT_BACKOFF));
    }

    public OptionLock(OptionStore options, TxRunner tx, Clock clock,
                      Duration ttl, int maxAttempts, RetryPolicy retry) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.options = Objects.requireNonNull(options, "options");
        this.tx = Objects.requireNonNull(tx, "tx");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.maxAttempts = maxAttempts;
        this.retry = Objects.requireNonNull(retry, "retry");
    }

    /**
     * 최대 {@code maxAttempts} 회 시도. 실패 시 false.
     * 저장소 예외는 호출자에게 전달한다 (rate limiter 가 fail-closed 로 처리).
     */
    public boolean acquire(String lockKey) throws Exception {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (tryAcquire(lockKey)) return true;
            if (attempt == maxAttempts) break;
            Duration backoff = retry.nextBackoff(attempt);
            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        log.debug("lock busy after {} attempts: {}", maxAttempts, lockKey);
        return false;
    }

    /** 단일 시도. 만료된 락이 남아 있으면 정리 후 한 번 더 시도한다. */
    public boolean tryAcquire(String lockKey) throws Exception {
        if (insertLockRows(lockKey)) return true;
        if (!clearIfExpired(lockKey)) return false;
        return insertLockRows(lockKey);
    }

    public void release(String lockKey) throws Exception {
        tx.requiresNew(() -> {
            options.delete(TransientCache.TIMEOUT_PREFIX + lockKey);
            options.delete(TransientCache.VALUE_PREFIX + lockKey);
            return null;
        });
    }

    /** 값 행에는 획득마다 새 토큰을 넣는다. 만료 정리 시 조건부 삭제의 기준이 된다. */
    private boolean insertLockRows(String lockKey) throws Exception {
        long expiresAt = clock.now().plus(ttl).getEpochSecond();
        String token = UUID.randomUUID().toString();
        int inserted = tx.requiresNew(() -> options.insertPairIfAbsent(
                TransientCache.TIMEOUT_PREFIX + lockKey, Long.toString(expiresAt),
                TransientCache.VALUE_PREFIX + lockKey, token));
        return inserted == 2;
    }

    /**
     * 관찰한 값 그대로일 때만 지운다. 같은 만료 락을 본 두 호출자 중 먼저 정리하고 재획득한 쪽의
     * 새 행은 나중 호출자의 삭제 조건에 맞지 않으므로 남는다.
     */
    private boolean clearIfExpired(String lockKey) throws Exception {
        String timeoutName = TransientCache.TIMEOUT_PREFIX + lockKey;
        String valueName = TransientCache.VALUE_PREFIX + lockKey;
        return tx.requiresNew(() -> {
            Optional<String> timeout = options.get(timeoutName);
            Optional<String> holder = options.get(valueName);
            // timeout 행 없이 남은 락 행도 만료로 본다
            if (timeout.isPresent() && !expired(timeout.get())) return false;
            if (timeout.isPresent() && !options.deleteIfValue(timeoutName, timeout.get())) return false;
            if (holder.isPresent() && !options.deleteIfValue(valueName, holder.get())) return false;
            log.info("removed expired lock: {}", lockKey);
            return true;
        });
    }

    private boolean expired(String timeout) {
        try {
            return Long.parseLong(timeout.trim()) < clock.now().getEpochSecond();
        } catch (NumberFormatException e) {
            return true;
        }
    }
}
