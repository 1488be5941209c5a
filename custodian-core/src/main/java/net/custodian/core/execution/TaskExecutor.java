package net.custodian.core.execution;

import net.custodian.core.model.TaskResult;
import net.custodian.core.spi.Clock;
import net.custodian.core.spi.HostScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 등록된 태스크를 id 로 실행. 프로세스 안에서 태스크 id 당 한 번에 하나의 슬라이스만.
 * 실행 중인 태스크를 다시 부르면 기다리지 않고 errors.lock 이 담긴 실패 결과를 돌려준다.
 * 중단된 슬라이스는 {@link TaskResult#nextRun()} 에 일회성 실행을 예약한다.
 */
public final class TaskExecutor {
    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    public static final String LOCK_ERROR_KEY = "lock";
    public static final String ALREADY_RUNNING = "Task is already running";

    private final HostScheduler host;
    private final Clock clock;
    private final Map<String, ScheduledTask> tasks = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public TaskExecutor(HostScheduler host, Clock clock) {
        this.host = Objects.requireNonNull(host, "host");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public TaskExecutor register(ScheduledTask task) {
        ScheduledTask prev = tasks.putIfAbsent(task.taskId(), task);
        if (prev != null && prev != task) {
            throw new IllegalStateException("task already registered: " + task.taskId());
        }
        return this;
    }

    public List<String> registeredTaskIds() {
        return List.copyOf(tasks.keySet());
    }

    public boolean isRunning(String taskId) {
        ReentrantLock lock = locks.get(taskId);
        return lock != null && lock.isLocked();
    }

    public Optional<TaskResult> run(String taskId) {
        return run(taskId, Map.of());
    }

    /** 등록되지 않은 taskId 는 empty */
    public Optional<TaskResult> run(String taskId, Map<String, ?> options) {
        ScheduledTask task = tasks.get(taskId);
        if (task == null) {
            log.warn("unknown task id: {}", taskId);
            return Optional.empty();
        }

        ReentrantLock lock = locks.computeIfAbsent(taskId, k -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.info("[{}] skipped: already running", taskId);
            return Optional.of(TaskResult.failure(taskId, Map.of(LOCK_ERROR_KEY, ALREADY_RUNNING), 0.0));
        }

        try {
            Instant startedAt = clock.now();
            ExecutionContext ctx = new ExecutionContext(taskId, startedAt,
                    options == null ? Map.of() : new LinkedHashMap<>(options));
            TaskResult result = execute(task, ctx, startedAt);
            if (result.interrupted() && result.nextRun() != null) {
                scheduleResume(taskId, result.nextRun());
            }
            return Optional.of(result);
        } finally {
            lock.unlock();
        }
    }

    private TaskResult execute(ScheduledTask task, ExecutionContext ctx, Instant startedAt) {
        String taskId = task.taskId();
        try {
            TaskResult result = task.execute(ctx);
            if (result == null) {
                return TaskResult.failure(taskId, Map.of("result", "Task returned no result"), elapsed(startedAt));
            }
            log.info("[{}] finished: success={}, interrupted={}, found={}, cleaned={}, bytes={}",
                    taskId, result.success(), result.interrupted(),
                    result.itemsFound(), result.itemsCleaned(), result.bytesFreed());
            return result;
        } catch (Exception e) {
            log.error("[{}] failed", taskId, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return TaskResult.failure(taskId, Map.of("exception", message), elapsed(startedAt));
        }
    }

    private void scheduleResume(String taskId, Instant at) {
        try {
            if (!host.scheduleOnce(taskId, at)) {
                log.warn("[{}] resume run was not accepted by the host scheduler", taskId);
            }
        } catch (Exception e) {
            log.warn("[{}] could not schedule resume run at {}", taskId, at, e);
        }
    }

    private double elapsed(Instant startedAt) {
        return Math.max(0, Duration.between(startedAt, clock.now()).toNanos() / 1_000_000_000.0);
    }
}
