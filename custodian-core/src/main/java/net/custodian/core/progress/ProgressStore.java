package net.custodian.core.progress;

import net.custodian.core.spi.Clock;
import net.custodian.core.spi.OptionStore;
import net.custodian.core.spi.TxRunner;
import net.custodian.core.support.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 태스크별 체크포인트 저장소. 다음 실행이 중단 지점부터 이어가도록 한다.
 * - {@link #forTask(String)} 로 얻은 인스턴스는 {@code progress_<taskId>} 에 바인딩
 * - 바인딩되지 않았거나 저장소 오류면 예외 없이 false/빈 값 (WARN 로그)
 * update 계열은 락 없는 read-modify-write 이다. 같은 태스크를 동시에 쓰면 갱신이 유실될 수 있으므로
 * 태스크당 슬라이스는 하나만 돌린다 ({@code TaskExecutor}).
 */
public final class ProgressStore {
    private static final Logger log = LoggerFactory.getLogger(ProgressStore.class);

    public static final String KEY_PREFIX = "progress_";

    public static final String COMPLETED_TASKS = "completed_tasks";
    public static final String ERRORS = "errors";
    public static final String SAVED_AT = "saved_at";
    public static final String INTERRUPTED_AT = "interrupted_at";

    public static final long DEFAULT_STALE_SECONDS = 3600;
    public static final long DEFAULT_PRUNE_SECONDS = 86400;

    // 예전 레코드의 "Y-m-d H:i:s" (UTC) 형식
    private static final DateTimeFormatter LEGACY_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final OptionStore options;
    private final TxRunner tx;
    private final Clock clock;
    private final String optionKey;

    /** unbound store; use {@link #forTask(String)} to obtain a bound one */
    public ProgressStore(OptionStore options, TxRunner tx, Clock clock) {
        this(options, tx, clock, "");
    }

    private ProgressStore(OptionStore options, TxRunner tx, Clock clock, String optionKey) {
        this.options = Objects.requireNonNull(options, "options");
        this.tx = Objects.requireNonNull(tx, "tx");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.optionKey = optionKey == null ? "" : optionKey;
    }

    public ProgressStore forTask(String taskId) {
        if (taskId == null || taskId.isEmpty()) {
            return new ProgressStore(options, tx, clock, "");
        }
        return new ProgressStore(options, tx, clock, KEY_PREFIX + taskId);
    }

    public String optionKey() {
        return optionKey;
    }

    public boolean isBound() {
        return !optionKey.isEmpty();
    }

    // --- per-task ---

    public Map<String, Object> load() {
        if (!isBound()) return new LinkedHashMap<>();
        try {
            return tx.required(() -> readCheckpoint(optionKey));
        } catch (Exception e) {
            log.warn("progress load failed: key={}", optionKey, e);
            return new LinkedHashMap<>();
        }
    }

    /** 전체 체크포인트 저장. saved_at 이 없으면 현재 시각으로 채운다. */
    public boolean save(Map<String, ?> data) {
        if (!isBound()) return false;
        Map<String, Object> copy = data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data);
        try {
            tx.required(() -> {
                writeCheckpoint(copy);
                return null;
            });
            return true;
        } catch (Exception e) {
            log.warn("progress save failed: key={}", optionKey, e);
            return false;
        }
    }

    public boolean saveInterrupted(Map<String, ?> data) {
        return saveInterrupted(data, Map.of());
    }

    /** interrupted_at 을 찍고, errors 가 있으면 기존 errors 에 병합하여 저장 */
    public boolean saveInterrupted(Map<String, ?> data, Map<String, String> errors) {
        Map<String, Object> copy = data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data);
        if (errors != null && !errors.isEmpty()) {
            Map<String, String> merged = asErrors(copy.get(ERRORS));
            merged.putAll(errors);
            copy.put(ERRORS, merged);
        }
        copy.put(INTERRUPTED_AT, clock.now().toString());
        return save(copy);
    }

    public boolean update(Map<String, ?> partial) {
        return modify(progress -> {
            if (partial != null) progress.putAll(partial);
        });
    }

    public boolean addCompletedTask(String name) {
        return modify(progress -> {
            LinkedHashSet<String> completed = new LinkedHashSet<>(asStringList(progress.get(COMPLETED_TASKS)));
            completed.add(name);
            progress.put(COMPLETED_TASKS, new ArrayList<>(completed));
        });
    }

    public boolean addError(String key, String message) {
        return modify(progress -> {
            Map<String, String> errors = asErrors(progress.get(ERRORS));
            errors.put(key, message);
            progress.put(ERRORS, errors);
        });
    }

    public boolean increment(String counter) {
        return increment(counter, 1);
    }

    /** 숫자가 아닌 기존 값은 0 으로 보고 더한다 */
    public boolean increment(String counter, long delta) {
        return modify(progress -> progress.put(counter, asLong(progress.get(counter)) + delta));
    }

    /**
     * 읽기와 쓰기를 한 트랜잭션에서 수행한다.
     * 읽기가 실패하면 쓰지 않고 false: 빈 맵으로 기존 체크포인트를 덮어쓰면 커서와 completed_tasks 가 사라진다.
     */
    private boolean modify(Consumer<Map<String, Object>> patch) {
        if (!isBound()) return false;
        try {
            tx.required(() -> {
                Map<String, Object> progress = readCheckpoint(optionKey);
                patch.accept(progress);
                writeCheckpoint(progress);
                return null;
            });
            return true;
        } catch (Exception e) {
            log.warn("progress update failed, checkpoint left unchanged: key={}", optionKey, e);
            return false;
        }
    }

    public boolean hasProgress() {
        return !load().isEmpty();
    }

    public Optional<Instant> getSavedAt() {
        return Optional.ofNullable(parseTimestamp(load().get(SAVED_AT)));
    }

    public Optional<Instant> getInterruptedAt() {
        return Optional.ofNullable(parseTimestamp(load().get(INTERRUPTED_AT)));
    }

    public List<String> getCompletedTasks() {
        return asStringList(load().get(COMPLETED_TASKS));
    }

    public Map<String, String> getErrors() {
        return asErrors(load().get(ERRORS));
    }

    public boolean isStale() {
        return isStale(DEFAULT_STALE_SECONDS);
    }

    /** 체크포인트가 없거나 saved_at 을 읽을 수 없으면 stale */
    public boolean isStale(long thresholdSeconds) {
        Instant savedAt = parseTimestamp(load().get(SAVED_AT));
        if (savedAt == null) return true;
        return Duration.between(savedAt, clock.now()).compareTo(Duration.ofSeconds(thresholdSeconds)) > 0;
    }

    public boolean clear() {
        if (!isBound()) return false;
        try {
            return tx.required(() -> options.delete(optionKey));
        } catch (Exception e) {
            log.warn("progress clear failed: key={}", optionKey, e);
            return false;
        }
    }

    // --- administrative sweep (all tasks) ---

    public int clearAll() {
        try {
            int deleted = tx.required(() ->
                    options.deleteByPattern(OptionStore.escapeLike(KEY_PREFIX) + "%"));
            log.info("progress clearAll: deleted={}", deleted);
            return deleted;
        } catch (Exception e) {
            log.warn("progress clearAll failed", e);
            return 0;
        }
    }

    /** task ids that currently have a checkpoint */
    public List<String> listAll() {
        return new ArrayList<>(loadAll().keySet());
    }

    /** taskId → checkpoint. 읽을 수 없는 행은 건너뛴다. */
    public Map<String, Map<String, Object>> loadAll() {
        Map<String, String> rows;
        try {
            rows = tx.required(() -> options.findByPrefix(KEY_PREFIX));
        } catch (Exception e) {
            log.warn("progress listAll failed", e);
            return new LinkedHashMap<>();
        }
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> row : rows.entrySet()) {
            try {
                out.put(row.getKey().substring(KEY_PREFIX.length()), Json.readMap(row.getValue()));
            } catch (Exception e) {
                log.debug("skipping unreadable checkpoint: {}", row.getKey(), e);
            }
        }
        return out;
    }

    public int count() {
        try {
            return tx.required(() -> options.countByPrefix(KEY_PREFIX));
        } catch (Exception e) {
            log.warn("progress count failed", e);
            return 0;
        }
    }

    public int pruneStale() {
        return pruneStale(DEFAULT_PRUNE_SECONDS);
    }

    /** saved_at 이 없거나 {@code maxAgeSeconds} 보다 오래된 체크포인트 삭제 */
    public int pruneStale(long maxAgeSeconds) {
        Instant cutoff = clock.now().minusSeconds(maxAgeSeconds);
        int pruned = 0;
        for (Map.Entry<String, Map<String, Object>> e : loadAll().entrySet()) {
            Instant savedAt = parseTimestamp(e.getValue().get(SAVED_AT));
            if (savedAt == null || savedAt.isBefore(cutoff)) {
                if (forTask(e.getKey()).clear()) pruned++;
            }
        }
        if (pruned > 0) log.info("pruned {} stale checkpoint(s) older than {}s", pruned, maxAgeSeconds);
        return pruned;
    }

    public ProgressStatistics statistics() {
        Map<String, Map<String, Object>> all = loadAll();
        Instant cutoff = clock.now().minus(Duration.ofHours(24));
        int stale = 0;
        int interrupted = 0;
        Instant oldest = null;
        Instant newest = null;

        for (Map<String, Object> progress : all.values()) {
            if (progress.get(INTERRUPTED_AT) != null) interrupted++;
            Instant savedAt = parseTimestamp(progress.get(SAVED_AT));
            if (savedAt == null) {
                stale++;
                continue;
            }
            if (savedAt.isBefore(cutoff)) stale++;
            if (oldest == null || savedAt.isBefore(oldest)) oldest = savedAt;
            if (newest == null || savedAt.isAfter(newest)) newest = savedAt;
        }
        return new ProgressStatistics(all.size(), stale, interrupted, oldest, newest);
    }

    // --- helpers ---

    private void writeCheckpoint(Map<String, Object> progress) throws Exception {
        if (progress.get(SAVED_AT) == null) {
            progress.put(SAVED_AT, clock.now().toString());
        }
        options.put(optionKey, Json.write(progress));
    }

    private Map<String, Object> readCheckpoint(String key) throws Exception {
        Optional<String> raw = options.get(key);
        if (raw.isEmpty()) return new LinkedHashMap<>();
        return Json.readMap(raw.get());
    }

    static Instant parseTimestamp(Object v) {
        if (v instanceof Instant i) return i;
        if (v instanceof Number n) return Instant.ofEpochSecond(n.longValue());
        if (!(v instanceof String s) || s.isBlank()) return null;
        String t = s.trim();
        try {
            return t.indexOf('T') >= 0
                    ? Instant.parse(t)
                    : LocalDateTime.parse(t, LEGACY_TIMESTAMP).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static List<String> asStringList(Object v) {
        List<String> out = new ArrayList<>();
        if (v instanceof Collection<?> c) {
            for (Object o : c) {
                if (o != null) out.add(o.toString());
            }
        }
        return out;
    }

    private static Map<String, String> asErrors(Object v) {
        Map<String, String> out = new LinkedHashMap<>();
        if (v instanceof Map<?, ?> m) {
            m.forEach((k, msg) -> out.put(String.valueOf(k), msg == null ? "" : msg.toString()));
        }
        return out;
    }

    private static long asLong(Object v) {
        if (v instanceof Number n) return n.longValue();
        if (v instanceof String s) {
            try { return Long.parseLong(s.trim()); } catch (NumberFormatException e) { return 0; }
        }
        return 0;
    }
}
