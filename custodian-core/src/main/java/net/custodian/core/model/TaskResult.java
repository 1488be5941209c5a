package net.custodian.core.model;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 태스크 실행 슬라이스 하나의 결과 (불변).
 * with/addCounts/addError 는 항상 새 인스턴스를 돌려준다. itemsCleaned &lt;= itemsFound 는 강제하지 않는다.
 */
public record TaskResult(
        boolean success,
        long itemsFound,
        long itemsCleaned,
        long bytesFreed,
        Map<String, String> errors,
        boolean interrupted,
        Instant nextRun,
        String taskId,
        Instant executedAt,
        double elapsedTime
) {
    public static final String KEY_INTERRUPTED = "interrupted";
    /** 예전 레코드에서 쓰던 필드명 */
    public static final String KEY_WAS_INTERRUPTED = "was_interrupted";

    public TaskResult {
        if (itemsFound < 0 || itemsCleaned < 0 || bytesFreed < 0) {
            throw new IllegalArgumentException("counts must be >= 0");
        }
        if (elapsedTime < 0 || Double.isNaN(elapsedTime)) {
            throw new IllegalArgumentException("elapsedTime must be >= 0");
        }
        errors = errors == null || errors.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        taskId = taskId == null ? "" : taskId;
    }

    public static TaskResult success(String taskId, long itemsFound, long itemsCleaned, long bytesFreed, double elapsed) {
        return new TaskResult(true, itemsFound, itemsCleaned, bytesFreed, Map.of(),
                false, null, taskId, Instant.now(), elapsed);
    }

    public static TaskResult success(String taskId) {
        return success(taskId, 0, 0, 0, 0.0);
    }

    public static TaskResult failure(String taskId, Map<String, String> errors, double elapsed) {
        return new TaskResult(false, 0, 0, 0, errors, false, null, taskId, Instant.now(), elapsed);
    }

    public static TaskResult interrupted(String taskId, long itemsFound, long itemsCleaned, long bytesFreed,
                                         Map<String, String> errors, Instant nextRun, double elapsed) {
        return new TaskResult(true, itemsFound, itemsCleaned, bytesFreed, errors,
                true, nextRun, taskId, Instant.now(), elapsed);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public TaskResult with(Patch patch) {
        Objects.requireNonNull(patch, "patch");
        return new TaskResult(
                patch.success != null ? patch.success : success,
                patch.itemsFound != null ? patch.itemsFound : itemsFound,
                patch.itemsCleaned != null ? patch.itemsCleaned : itemsCleaned,
                patch.bytesFreed != null ? patch.bytesFreed : bytesFreed,
                patch.errorsSet ? patch.errors : errors,
                patch.interrupted != null ? patch.interrupted : interrupted,
                patch.nextRunSet ? patch.nextRun : nextRun,
                patch.taskIdSet ? patch.taskId : taskId,
                patch.executedAtSet ? patch.executedAt : executedAt,
                patch.elapsedTime != null ? patch.elapsedTime : elapsedTime
        );
    }

    public TaskResult addCounts(long found, long cleaned, long bytes) {
        return with(patch()
                .itemsFound(itemsFound + found)
                .itemsCleaned(itemsCleaned + cleaned)
                .bytesFreed(bytesFreed + bytes));
    }

    public TaskResult addCounts(long found, long cleaned) {
        return addCounts(found, cleaned, 0);
    }

    public TaskResult addCounts(long found) {
        return addCounts(found, 0, 0);
    }

    public TaskResult addCounts() {
        return addCounts(0, 0, 0);
    }

    public TaskResult addError(String key, String message) {
        Map<String, String> next = new LinkedHashMap<>(errors);
        next.put(key, message);
        return with(patch().errors(next));
    }

    // --- map transport ---

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("success", success);
        m.put("items_found", itemsFound);
        m.put("items_cleaned", itemsCleaned);
        m.put("bytes_freed", bytesFreed);
        m.put("errors", new LinkedHashMap<>(errors));
        m.put(KEY_INTERRUPTED, interrupted);
        m.put(KEY_WAS_INTERRUPTED, interrupted);
        m.put("next_run", nextRun == null ? null : nextRun.toString());
        m.put("task_id", taskId);
        m.put("executed_at", executedAt == null ? null : executedAt.toString());
        m.put("elapsed_time", elapsedTime);
        return m;
    }

    /**
     * Lenient inverse of {@link #toMap()}. Accepts either interruption alias; a record
     * without {@code items_found} reuses {@code items_cleaned}.
     */
    public static TaskResult fromMap(Map<String, ?> data) {
        if (data == null) data = Map.of();
        long cleaned = asLong(data.get("items_cleaned"), 0);
        long found = data.get("items_found") != null ? asLong(data.get("items_found"), cleaned) : cleaned;
        Object interruptedRaw = data.get(KEY_INTERRUPTED) != null
                ? data.get(KEY_INTERRUPTED)
                : data.get(KEY_WAS_INTERRUPTED);
        return new TaskResult(
                asBoolean(data.get("success"), true),
                found,
                cleaned,
                asLong(data.get("bytes_freed"), 0),
                asErrors(data.get("errors")),
                asBoolean(interruptedRaw, false),
                asInstant(data.get("next_run")),
                data.get("task_id") == null ? "" : data.get("task_id").toString(),
                asInstant(data.get("executed_at")),
                asDouble(data.get("elapsed_time"))
        );
    }

    private static long asLong(Object v, long dflt) {
        if (v instanceof Number n) return Math.max(0, n.longValue());
        if (v instanceof String s) {
            try { return Math.max(0, Long.parseLong(s.trim())); } catch (NumberFormatException e) { return dflt; }
        }
        return dflt;
    }

    private static double asDouble(Object v) {
        if (v instanceof Number n) return Math.max(0.0, n.doubleValue());
        if (v instanceof String s) {
            try { return Math.max(0.0, Double.parseDouble(s.trim())); } catch (NumberFormatException e) { return 0.0; }
        }
        return 0.0;
    }

    private static boolean asBoolean(Object v, boolean dflt) {
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.intValue() != 0;
        if (v instanceof String s) return s.equalsIgnoreCase("true") || s.equals("1");
        return dflt;
    }

    private static Instant asInstant(Object v) {
        if (v instanceof Instant i) return i;
        if (v instanceof Number n) return Instant.ofEpochSecond(n.longValue());
        if (v instanceof String s && !s.isBlank()) {
            try { return Instant.parse(s.trim()); } catch (DateTimeParseException e) { return null; }
        }
        return null;
    }

    private static Map<String, String> asErrors(Object v) {
        if (!(v instanceof Map<?, ?> raw)) return Map.of();
        Map<String, String> out = new LinkedHashMap<>();
        raw.forEach((k, msg) -> out.put(String.valueOf(k), msg == null ? "" : msg.toString()));
        return out;
    }

    public static Patch patch() {
        return new Patch();
    }

    /** Partial field set for {@link #with(Patch)}; unset fields keep the original value. */
    public static final class Patch {
        private Boolean success;
        private Long itemsFound;
        private Long itemsCleaned;
        private Long bytesFreed;
        private Map<String, String> errors;
        private Boolean interrupted;
        private Instant nextRun;
        private String taskId;
        private Instant executedAt;
        private Double elapsedTime;
        // null 이 유효한 값인 필드는 지정 여부를 따로 기록한다 (nextRun(null) = 재개 시각 제거)
        private boolean errorsSet;
        private boolean nextRunSet;
        private boolean taskIdSet;
        private boolean executedAtSet;

        private Patch() {}

        public Patch success(boolean v) { this.success = v; return this; }
        public Patch itemsFound(long v) { this.itemsFound = v; return this; }
        public Patch itemsCleaned(long v) { this.itemsCleaned = v; return this; }
        public Patch bytesFreed(long v) { this.bytesFreed = v; return this; }
        public Patch errors(Map<String, String> v) { this.errors = v; this.errorsSet = true; return this; }
        public Patch interrupted(boolean v) { this.interrupted = v; return this; }
        public Patch nextRun(Instant v) { this.nextRun = v; this.nextRunSet = true; return this; }
        public Patch taskId(String v) { this.taskId = v; this.taskIdSet = true; return this; }
        public Patch executedAt(Instant v) { this.executedAt = v; this.executedAtSet = true; return this; }
        public Patch elapsedTime(double v) { this.elapsedTime = v; return this; }
    }
}
