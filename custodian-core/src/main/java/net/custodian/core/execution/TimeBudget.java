package net.custodian.core.execution;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 슬라이스 하나에 허용된 시간. {@code limit - buffer} 를 넘기면 작업을 멈추고 체크포인트를 남긴다.
 */
public record TimeBudget(Duration limit, Duration buffer) {
    public static final Duration DEFAULT_LIMIT = Duration.ofSeconds(25);
    public static final Duration DEFAULT_BUFFER = Duration.ofSeconds(3);
    public static final Duration MINIMUM_LIMIT = Duration.ofSeconds(5);

    public TimeBudget {
        if (limit == null || limit.isNegative() || limit.isZero()) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if (buffer == null || buffer.isNegative()) {
            throw new IllegalArgumentException("buffer must be >= 0");
        }
    }

    /**
     * options 의 {@code time_limit}(양의 정수, 초)가 있으면 그 값을 그대로 쓰고,
     * 없으면 {@code defaultLimit} 과 {@code minimum} 중 큰 값.
     */
    public static TimeBudget configure(Map<String, ?> options, Duration defaultLimit, Duration buffer, Duration minimum) {
        Long override = positiveSeconds(options == null ? null : options.get(ExecutionContext.OPTION_TIME_LIMIT));
        if (override != null) {
            return new TimeBudget(Duration.ofSeconds(override), buffer);
        }
        Duration limit = defaultLimit.compareTo(minimum) >= 0 ? defaultLimit : minimum;
        return new TimeBudget(limit, buffer);
    }

    public boolean isApproaching(Instant startedAt, Instant now) {
        return Duration.between(startedAt, now).compareTo(limit.minus(buffer)) >= 0;
    }

    public Duration remaining(Instant startedAt, Instant now) {
        Duration left = limit.minus(buffer).minus(Duration.between(startedAt, now));
        return left.isNegative() ? Duration.ZERO : left;
    }

    private static Long positiveSeconds(Object raw) {
        if (raw instanceof Integer || raw instanceof Long) {
            long v = ((Number) raw).longValue();
            return v > 0 ? v : null;
        }
        if (raw instanceof String s && !s.isEmpty() && s.chars().allMatch(Character::isDigit)) {
            try {
                long v = Long.parseLong(s);
                return v > 0 ? v : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
