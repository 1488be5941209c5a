package net.custodian.core.execution;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TimeBudgetTest {

    private static final Instant START = Instant.parse("2026-03-10T02:00:00Z");

    private static TimeBudget configure(Map<String, ?> options) {
        return TimeBudget.configure(options, TimeBudget.DEFAULT_LIMIT, TimeBudget.DEFAULT_BUFFER, TimeBudget.MINIMUM_LIMIT);
    }

    @Test
    void defaultsWithoutOverride() {
        assertThat(configure(Map.of()).limit()).isEqualTo(Duration.ofSeconds(25));
    }

    @Test
    void timeLimitOptionOverrides() {
        assertThat(configure(Map.of("time_limit", 40)).limit()).isEqualTo(Duration.ofSeconds(40));
        assertThat(configure(Map.of("time_limit", "90")).limit()).isEqualTo(Duration.ofSeconds(90));
        // 최소값보다 작아도 명시 값은 그대로
        assertThat(configure(Map.of("time_limit", 2L)).limit()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void invalidOverridesAreIgnored() {
        assertThat(configure(Map.of("time_limit", -5)).limit()).isEqualTo(Duration.ofSeconds(25));
        assertThat(configure(Map.of("time_limit", "1.5")).limit()).isEqualTo(Duration.ofSeconds(25));
        assertThat(configure(Map.of("time_limit", 0)).limit()).isEqualTo(Duration.ofSeconds(25));
    }

    @Test
    void defaultBelowMinimumIsRaised() {
        TimeBudget b = TimeBudget.configure(Map.of(), Duration.ofSeconds(1), Duration.ZERO, Duration.ofSeconds(5));

        assertThat(b.limit()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void approachingAtLimitMinusBuffer() {
        TimeBudget b = new TimeBudget(Duration.ofSeconds(25), Duration.ofSeconds(3));

        assertThat(b.isApproaching(START, START.plusSeconds(21))).isFalse();
        assertThat(b.isApproaching(START, START.plusSeconds(22))).isTrue();
        assertThat(b.remaining(START, START.plusSeconds(20))).isEqualTo(Duration.ofSeconds(2));
        assertThat(b.remaining(START, START.plusSeconds(30))).isEqualTo(Duration.ZERO);
    }
}
