package net.custodian.core.execution;

import net.custodian.core.model.TaskResult;
import net.custodian.core.progress.ProgressStore;
import net.custodian.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * 재개 가능한 태스크의 기반 클래스.
 * - execute 가 시작 시각과 {@link TimeBudget} 을 준비하고 {@link #run(ExecutionContext)} 을 호출
 * - 하위 클래스는 작업 단위 사이에 {@link #isTimeLimitApproaching()} 을 확인하고 결과 헬퍼로 끝낸다
 * - {@link #interruptedResult} 가 체크포인트를 저장한다
 * 인스턴스가 슬라이스 상태를 가지므로 같은 태스크를 동시에 돌리면 안 된다.
 */
public abstract class AbstractScheduledTask implements ScheduledTask {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    public static final Duration DEFAULT_RESUME_DELAY = Duration.ofMinutes(1);

    private final String taskId;
    private final Clock clock;
    private final ProgressStore progress;

    private Duration defaultTimeLimit = TimeBudget.DEFAULT_LIMIT;
    private Duration timeBuffer = TimeBudget.DEFAULT_BUFFER;
    private Duration minimumTimeLimit = TimeBudget.MINIMUM_LIMIT;
    private Duration resumeDelay = DEFAULT_RESUME_DELAY;

    private Instant startedAt;
    private TimeBudget budget;

    /** @param progressStore unbound store; bound to {@code taskId} here */
    protected AbstractScheduledTask(String taskId, ProgressStore progressStore, Clock clock) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.progress = progressStore.forTask(taskId);
    }

    @Override
    public String taskId() {
        return taskId;
    }

    @Override
    public final TaskResult execute(ExecutionContext context) throws Exception {
        startedAt = clock.now();
        budget = TimeBudget.configure(context.options(), defaultTimeLimit, timeBuffer, minimumTimeLimit);
        if (progress.hasProgress()) {
            log.info("[{}] resuming from saved progress", taskId);
        }
        return run(context);
    }

    protected abstract TaskResult run(ExecutionContext context) throws Exception;

    // --- time budget ---

    protected boolean isTimeLimitApproaching() {
        if (startedAt == null || budget == null) return false;
        return budget.isApproaching(startedAt, clock.now());
    }

    protected Duration remainingTime() {
        if (startedAt == null || budget == null) return Duration.ZERO;
        return budget.remaining(startedAt, clock.now());
    }

    protected double elapsedSeconds() {
        if (startedAt == null) return 0.0;
        return Duration.between(startedAt, clock.now()).toNanos() / 1_000_000_000.0;
    }

    protected TimeBudget budget() {
        return budget;
    }

    protected Clock clock() {
        return clock;
    }

    // --- progress ---

    protected ProgressStore progress() {
        return progress;
    }

    /** 수동 초기화 (관리자 요청) */
    public boolean resetProgress() {
        log.info("[{}] progress manually reset", taskId);
        return progress.clear();
    }

    public boolean hasPendingProgress() {
        return progress.hasProgress();
    }

    // --- results ---

    /** 완료: 체크포인트를 지운다 */
    protected TaskResult successResult(long itemsFound, long itemsCleaned, long bytesFreed) {
        progress.clear();
        return TaskResult.success(taskId, itemsFound, itemsCleaned, bytesFreed, elapsedSeconds());
    }

    protected TaskResult failureResult(Map<String, String> errors) {
        return TaskResult.failure(taskId, errors, elapsedSeconds());
    }

    /**
     * 시간 초과로 중단. {@code checkpoint} 를 interrupted_at 과 함께 저장하고
     * {@code now + resumeDelay} 를 다음 실행 시각으로 돌려준다.
     */
    protected TaskResult interruptedResult(Map<String, ?> checkpoint,
                                           long itemsFound, long itemsCleaned, long bytesFreed,
                                           Map<String, String> errors) {
        if (!progress.saveInterrupted(checkpoint, errors)) {
            log.warn("[{}] checkpoint could not be saved; next slice restarts from the last saved state", taskId);
        }
        Instant nextRun = clock.now().plus(resumeDelay);
        log.info("[{}] interrupted: found={}, cleaned={}, nextRun={}", taskId, itemsFound, itemsCleaned, nextRun);
        return TaskResult.interrupted(taskId, itemsFound, itemsCleaned, bytesFreed, errors, nextRun, elapsedSeconds());
    }

    // --- tuning (subclass constructors) ---

    protected void setDefaultTimeLimit(Duration defaultTimeLimit) {
        this.defaultTimeLimit = Objects.requireNonNull(defaultTimeLimit);
    }

    protected void setTimeBuffer(Duration timeBuffer) {
        this.timeBuffer = Objects.requireNonNull(timeBuffer);
    }

    protected void setMinimumTimeLimit(Duration minimumTimeLimit) {
        this.minimumTimeLimit = Objects.requireNonNull(minimumTimeLimit);
    }

    protected void setResumeDelay(Duration resumeDelay) {
        this.resumeDelay = Objects.requireNonNull(resumeDelay);
    }
}
