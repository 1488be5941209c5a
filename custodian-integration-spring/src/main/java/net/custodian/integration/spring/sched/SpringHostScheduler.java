package net.custodian.integration.spring.sched;

import net.custodian.core.model.Frequency;
import net.custodian.core.spi.Clock;
import net.custodian.core.spi.HostScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * 스프링 {@link TaskScheduler} 위의 HostScheduler.
 * 발화 시 {@code dispatcher} 에 taskId 를 넘긴다. 스케줄은 프로세스 메모리에만 있으므로
 * 재시작 후에는 reconcile 이 다시 등록한다.
 */
public final class SpringHostScheduler implements HostScheduler {
    private static final Logger log = LoggerFactory.getLogger(SpringHostScheduler.class);

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Consumer<String> dispatcher;

    private final Map<String, Recurring> recurring = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> oneShots = new ConcurrentHashMap<>();

    public SpringHostScheduler(TaskScheduler scheduler, Clock clock, Consumer<String> dispatcher) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    @Override
    public boolean schedule(String taskId, Instant firstRun, Frequency frequency) {
        if (frequency == null || !frequency.schedulable()) return false;
        cancelRecurring(taskId);
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(() -> fire(taskId), firstRun, frequency.interval());
        recurring.put(taskId, new Recurring(f, frequency, firstRun));
        return true;
    }

    @Override
    public boolean scheduleOnce(String taskId, Instant at) {
        ScheduledFuture<?> prev = oneShots.remove(taskId);
        if (prev != null) prev.cancel(false);

        ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
        self[0] = scheduler.schedule(() -> {
            oneShots.remove(taskId, self[0]);
            fire(taskId);
        }, at);
        oneShots.put(taskId, self[0]);
        return true;
    }

    /** 등록이 없어도 true (이미 해제된 상태) */
    @Override
    public boolean unschedule(String taskId) {
        cancelRecurring(taskId);
        ScheduledFuture<?> once = oneShots.remove(taskId);
        if (once != null) once.cancel(false);
        return true;
    }

    @Override
    public boolean isScheduled(String taskId) {
        return recurring.containsKey(taskId);
    }

    @Override
    public Optional<Instant> nextRun(String taskId) {
        Recurring r = recurring.get(taskId);
        if (r == null) return Optional.empty();
        return Optional.of(r.nextAfter(clock.now()));
    }

    @Override
    public Optional<Frequency> scheduledFrequency(String taskId) {
        Recurring r = recurring.get(taskId);
        return r == null ? Optional.empty() : Optional.of(r.frequency());
    }

    @Override
    public Map<String, Instant> listScheduled() {
        Instant now = clock.now();
        Map<String, Instant> out = new LinkedHashMap<>();
        recurring.forEach((taskId, r) -> out.put(taskId, r.nextAfter(now)));
        return out;
    }

    /** 대기 중인 1회성 재개 실행이 있는지 */
    public boolean hasPendingResume(String taskId) {
        return oneShots.containsKey(taskId);
    }

    private void cancelRecurring(String taskId) {
        Recurring prev = recurring.remove(taskId);
        if (prev != null) prev.future().cancel(false);
    }

    private void fire(String taskId) {
        try {
            dispatcher.accept(taskId);
        } catch (RuntimeException e) {
            // 예외가 스케줄러 스레드로 새면 fixed-rate 반복이 멈춘다
            log.error("[{}] scheduled run failed", taskId, e);
        }
    }

    private record Recurring(ScheduledFuture<?> future, Frequency frequency, Instant firstRun) {
        /** firstRun + k * interval 중 now 이후 가장 이른 시각 */
        Instant nextAfter(Instant now) {
            if (firstRun.isAfter(now)) return firstRun;
            Duration interval = frequency.interval();
            long periods = Duration.between(firstRun, now).dividedBy(interval) + 1;
            return firstRun.plus(interval.multipliedBy(periods));
        }
    }
}
