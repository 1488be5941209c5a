package net.custodian.core.cache;

import net.custodian.core.spi.Clock;
import net.custodian.core.spi.OptionStore;
import net.custodian.core.spi.TxRunner;
import net.custodian.core.support.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link OptionStore} 행으로 저장하는 {@link CacheBackend}.
 * - {@code _transient_<key>}: JSON envelope {@code {"found":true,"value":...}} (null/false 저장값과 miss 구분)
 * - {@code _transient_timeout_<key>}: 만료 epoch 초 (없으면 만료 없음)
 * 값은 JSON 을 거치므로 숫자는 Integer/Long/Double, 객체는 Map 으로 돌아온다.
 * 저장소 오류는 로그 후 {@link Lookup#failure()} 또는 false.
 */
public final class TransientCache implements CacheBackend {
    private static final Logger log = LoggerFactory.getLogger(TransientCache.class);

    public static final String VALUE_PREFIX = "_transient_";
    public static final String TIMEOUT_PREFIX = "_transient_timeout_";

    /** option_name 컬럼 한도 */
    static final int MAX_OPTION_NAME = 172;
    /** TIMEOUT_PREFIX(19자)를 붙여도 한도를 넘지 않는 최대 키 길이 */
    static final int MAX_KEY_LENGTH = MAX_OPTION_NAME - TIMEOUT_PREFIX.length();
    /** 긴 키: 앞부분 + '_' + md5(32자) */
    static final int HASHED_BASE_LENGTH = MAX_KEY_LENGTH - 33;

    private final String prefix;
    private final OptionStore options;
    private final TxRunner tx;
    private final Clock clock;

    public TransientCache(String prefix, OptionStore options) {
        this(prefix, options, TxRunner.direct(), Clock.system());
    }

    public TransientCache(String prefix, OptionStore options, TxRunner tx, Clock clock) {
        this.prefix = prefix == null ? "" : prefix;
        this.options = Objects.requireNonNull(options, "options");
        this.tx = Objects.requireNonNull(tx, "tx");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String prefix() {
        return prefix;
    }

    @Override
    public Lookup lookup(String key) {
        String name = buildKey(key);
        try {
            return tx.required(() -> read(name));
        } catch (Exception e) {
            log.warn("transient read failed: key={}", name, e);
            return Lookup.failure();
        }
    }

    @Override
    public boolean set(String key, Object value, long ttlSeconds) {
        String name = buildKey(key);
        try {
            String envelope = wrap(value);
            tx.required(() -> {
                write(name, envelope, ttlSeconds);
                return null;
            });
            return true;
        } catch (Exception e) {
            log.warn("transient write failed: key={}", name, e);
            return false;
        }
    }

    @Override
    public boolean delete(String key) {
        String name = buildKey(key);
        try {
            return tx.required(() -> {
                options.delete(TIMEOUT_PREFIX + name);
                return options.delete(VALUE_PREFIX + name);
            });
        } catch (Exception e) {
            log.warn("transient delete failed: key={}", name, e);
            return false;
        }
    }

    /** 값 행과 timeout 행을 escape 된 LIKE prefix 로 일괄 삭제 */
    @Override
    public boolean clear(String keyPrefix) {
        String escaped = OptionStore.escapeLike(buildKey(keyPrefix == null ? "" : keyPrefix));
        try {
            int removed = tx.required(() ->
                    options.deleteByPattern(OptionStore.escapeLike(VALUE_PREFIX) + escaped + "%")
                            + options.deleteByPattern(OptionStore.escapeLike(TIMEOUT_PREFIX) + escaped + "%"));
            log.debug("transient clear: prefix={}, removed={}", keyPrefix, removed);
            return true;
        } catch (Exception e) {
            log.warn("transient clear failed: prefix={}", keyPrefix, e);
            return false;
        }
    }

    @Override
    public OptionalLong increment(String key, long delta) {
        return adjust(key, delta, false);
    }

    @Override
    public OptionalLong decrement(String key, long delta) {
        return adjust(key, -delta, true);
    }

    /** read-modify-write 이므로 원자적이지 않다. 만료 시각(timeout 행)은 유지한다. */
    private OptionalLong adjust(String key, long delta, boolean floorAtZero) {
        String name = buildKey(key);
        try {
            return tx.required(() -> {
                Lookup current = read(name);
                long base;
                if (!current.found()) {
                    base = 0;
                } else {
                    Long n = CacheBackend.asCount(current.value());
                    if (n == null) return OptionalLong.empty();
                    base = n;
                }
                long next = base + delta;
                if (floorAtZero && next < 0) next = 0;
                options.put(VALUE_PREFIX + name, wrap(next));
                return OptionalLong.of(next);
            });
        } catch (Exception e) {
            log.warn("transient incr failed: key={}", name, e);
            return OptionalLong.empty();
        }
    }

    /** prefix + key; 길이 초과 시 해시 접미사로 축약 */
    String buildKey(String key) {
        String full = prefix + Objects.requireNonNull(key, "key");
        if (full.length() <= MAX_KEY_LENGTH) return full;
        return full.substring(0, HASHED_BASE_LENGTH) + "_" + md5Hex(full);
    }

    // --- row access (must run inside tx) ---

    private Lookup read(String name) throws Exception {
        Optional<String> timeout = options.get(TIMEOUT_PREFIX + name);
        if (timeout.isPresent() && isExpired(timeout.get())) {
            options.delete(VALUE_PREFIX + name);
            options.delete(TIMEOUT_PREFIX + name);
            return Lookup.notFound();
        }
        Optional<String> raw = options.get(VALUE_PREFIX + name);
        if (raw.isEmpty()) return Lookup.notFound();
        return unwrap(raw.get());
    }

    private void write(String name, String envelope, long ttlSeconds) throws Exception {
        if (ttlSeconds > 0) {
            long expiresAt = clock.now().getEpochSecond() + ttlSeconds;
            options.put(TIMEOUT_PREFIX + name, Long.toString(expiresAt));
        } else {
            options.delete(TIMEOUT_PREFIX + name);
        }
        options.put(VALUE_PREFIX + name, envelope);
    }

    private boolean isExpired(String timeout) {
        try {
            return clock.now().getEpochSecond() >= Long.parseLong(timeout.trim());
        } catch (NumberFormatException e) {
            // 손상된 timeout 은 만료로 취급
            return true;
        }
    }

    private static String wrap(Object value) throws Exception {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("found", true);
        envelope.put("value", value);
        return Json.write(envelope);
    }

    private static Lookup unwrap(String raw) {
        try {
            Map<String, Object> envelope = Json.readMap(raw);
            if (Boolean.TRUE.equals(envelope.get("found"))) {
                return Lookup.found(envelope.get("value"));
            }
        } catch (Exception e) {
            log.debug("transient envelope unreadable, treated as miss", e);
        }
        return Lookup.notFound();
    }

    static String md5Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
