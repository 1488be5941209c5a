package net.custodian.core.execution;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 실행 슬라이스 하나의 입력.
 *
 * @param options 수동 실행/테스트용 재정의 값 (예: {@code time_limit} 초)
 */
public record ExecutionContext(String taskId, Instant startedAt, Map<String, Object> options) {
    public static final String OPTION_TIME_LIMIT = "time_limit";

    public ExecutionContext {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(startedAt, "startedAt");
        options = options == null || options.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public Object option(String key) {
        return options.get(key);
    }
}
