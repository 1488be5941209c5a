package net.custodian.integration.spring.sched;

import net.custodian.core.model.Frequency;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class SpringHostSchedulerTest {

    private ThreadPoolTaskScheduler taskScheduler;
    private final List<String> fired = new CopyOnWriteArrayList<>();
    private SpringHostScheduler host;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(2);
        taskScheduler.setThreadNamePrefix("custodian-test-");
        taskScheduler.initialize();
        host = new SpringHostScheduler(taskScheduler, Instant::now, fired::add);
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    @Test
    void recurringScheduleIsVisibleUntilUnscheduled() {
        Instant firstRun = Instant.now().plus(Duration.ofHours(2));

        assertThat(host.schedule("media_scan", firstRun, Frequency.WEEKLY)).isTrue();

        assertThat(host.isScheduled("media_scan")).isTrue();
        assertThat(host.scheduledFrequency("media_scan")).contains(Frequency.WEEKLY);
        assertThat(host.nextRun("media_scan")).contains(firstRun);
        assertThat(host.listScheduled()).containsOnlyKeys("media_scan");

        assertThat(host.unschedule("media_scan")).isTrue();
        assertThat(host.isScheduled("media_scan")).isFalse();
        assertThat(host.nextRun("media_scan")).isEmpty();
        assertThat(host.listScheduled()).isEmpty();
    }

    @Test
    void rescheduleReplacesFrequency() {
        Instant firstRun = Instant.now().plus(Duration.ofHours(1));
        host.schedule("database_cleanup", firstRun, Frequency.WEEKLY);
        host.schedule("database_cleanup", firstRun, Frequency.DAILY);

        assertThat(host.scheduledFrequency("database_cleanup")).contains(Frequency.DAILY);
        assertThat(host.listScheduled()).hasSize(1);
    }

    @Test
    void disabledFrequencyIsRejected() {
        assertThat(host.schedule("media_scan", Instant.now(), Frequency.DISABLED)).isFalse();
        assertThat(host.isScheduled("media_scan")).isFalse();
    }

    @Test
    void nextRunAdvancesPastElapsedPeriods() {
        Instant now = Instant.parse("2026-03-10T12:00:00Z");
        SpringHostScheduler fixed = new SpringHostScheduler(taskScheduler, () -> now, fired::add);
        // 지난 firstRun 은 실제 스케줄러에서 즉시 한 번 발화한다. 여기서는 nextRun 계산만 확인
        Instant firstRun = Instant.parse("2026-03-08T02:00:00Z");
        fixed.schedule("performance_check", firstRun, Frequency.DAILY);

        assertThat(fixed.nextRun("performance_check")).contains(Instant.parse("2026-03-11T02:00:00Z"));
        fixed.unschedule("performance_check");
    }

    @Test
    void oneShotFiresOnceAndIsNotListed() {
        host.scheduleOnce("media_scan", Instant.now().plusMillis(200));

        assertThat(host.hasPendingResume("media_scan")).isTrue();
        assertThat(host.isScheduled("media_scan")).isFalse();
        assertThat(host.listScheduled()).isEmpty();

        await().atMost(Duration.ofSeconds(5)).until(() -> fired.contains("media_scan"));
        await().atMost(Duration.ofSeconds(2)).until(() -> !host.hasPendingResume("media_scan"));
        assertThat(fired).containsExactly("media_scan");
    }

    @Test
    void unscheduleCancelsPendingResume() throws Exception {
        host.scheduleOnce("database_cleanup", Instant.now().plusMillis(300));
        host.unschedule("database_cleanup");

        Thread.sleep(600);
        assertThat(fired).isEmpty();
        assertThat(host.hasPendingResume("database_cleanup")).isFalse();
    }

    @Test
    void dispatcherFailureDoesNotStopLaterRuns() {
        List<String> seen = new CopyOnWriteArrayList<>();
        SpringHostScheduler failing = new SpringHostScheduler(taskScheduler, Instant::now, id -> {
            seen.add(id);
            throw new IllegalStateException("boom");
        });

        failing.scheduleOnce("a", Instant.now().plusMillis(50));
        failing.scheduleOnce("b", Instant.now().plusMillis(100));

        await().atMost(Duration.ofSeconds(5)).until(() -> seen.size() == 2);
        assertThat(seen).containsExactlyInAnyOrder("a", "b");
    }
}
