package net.custodian.core.service;

import net.custodian.core.model.Frequency;
import net.custodian.core.model.TaskDefinition;
import net.custodian.core.spi.Clock;
import net.custodian.core.spi.HostScheduler;
import net.custodian.core.spi.SettingsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 태스크 설정과 호스트 스케줄러 상태를 맞춘다.
 * 각 {@link TaskDefinition} 이 활성화/주기({@link Frequency}) 설정 키를 가리키고,
 * {@link #reconcile()} 이 실제 등록 상태와 비교해 차이를 고친다. 첫 실행은 선호 시각에 둔다.
 */
public final class SchedulingService {
    private static final Logger log = LoggerFactory.getLogger(SchedulingService.class);

    public static final int DEFAULT_PREFERRED_HOUR = 2;

    private final SettingsProvider settings;
    private final HostScheduler host;
    private final Clock clock;
    private final ZoneId zone;
    private final Map<String, TaskDefinition> tasks = new LinkedHashMap<>();

    public SchedulingService(SettingsProvider settings, HostScheduler host, Clock clock) {
        this(settings, host, clock, ZoneId.of("UTC"), TaskDefinition.builtIn());
    }

    public SchedulingService(SettingsProvider settings, HostScheduler host, Clock clock,
                             ZoneId zone, List<TaskDefinition> definitions) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.host = Objects.requireNonNull(host, "host");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = Objects.requireNonNull(zone, "zone");
        for (TaskDefinition d : definitions) {
            tasks.put(d.taskId(), d);
        }
    }

    // --- registry ---

    public List<String> getKnownTaskIds() {
        return List.copyOf(tasks.keySet());
    }

    public Optional<TaskDefinition> getTaskConfig(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    // --- next-run ---

    public Instant calculateNextRunTime() {
        return calculateNextRunTime(null);
    }

    /**
     * 다음 선호 시각(정시)을 계산한다. 오늘 그 시각이 아직 오지 않았으면 오늘, 지났거나 정확히 지금이면 내일.
     *
     * @param preferredHour null 이면 preferred_time 설정값 사용. 0..23 으로 보정된다.
     */
    public Instant calculateNextRunTime(Integer preferredHour) {
        int hour = preferredHour != null
                ? preferredHour
                : settings.getInt(SettingsProvider.PREFERRED_TIME, DEFAULT_PREFERRED_HOUR);
        hour = Math.min(23, Math.max(0, hour));

        ZonedDateTime now = clock.now().atZone(zone);
        ZonedDateTime preferred = now.toLocalDate().atTime(hour, 0).atZone(zone);
        if (!preferred.toInstant().isAfter(now.toInstant())) {
            preferred = preferred.plusDays(1);
        }
        return preferred.toInstant();
    }

    // --- single-task operations ---

    /**
     * 기존 스케줄을 지우고 {@code frequency} 로 다시 등록한다. {@code DISABLED} 는 해제와 같다.
     *
     * @param nextRun null 이면 {@link #calculateNextRunTime()}
     */
    public boolean schedule(String taskId, Frequency frequency, Instant nextRun) throws Exception {
        if (frequency == null) return false;
        if (frequency == Frequency.DISABLED) return unschedule(taskId);

        Instant firstRun = nextRun != null ? nextRun : calculateNextRunTime();
        host.unschedule(taskId);
        boolean ok = host.schedule(taskId, firstRun, frequency);
        if (ok) {
            log.info("task scheduled: taskId={}, frequency={}, firstRun={}", taskId, frequency.code(), firstRun);
        }
        return ok;
    }

    public boolean reschedule(String taskId, Frequency frequency, Instant nextRun) throws Exception {
        unschedule(taskId);
        if (frequency == Frequency.DISABLED) return true;
        return schedule(taskId, frequency, nextRun);
    }

    public boolean unschedule(String taskId) throws Exception {
        boolean ok = host.unschedule(taskId);
        log.info("task unscheduled: taskId={}", taskId);
        return ok;
    }

    /** @return 등록된 태스크 중 해제 요청에 성공한 수 */
    public int unscheduleAll() throws Exception {
        int count = 0;
        for (String taskId : tasks.keySet()) {
            if (unschedule(taskId)) count++;
        }
        return count;
    }

    public Optional<Instant> getNextRun(String taskId) throws Exception {
        return host.nextRun(taskId);
    }

    public boolean isScheduled(String taskId) throws Exception {
        return host.isScheduled(taskId);
    }

    public Optional<Frequency> getFrequency(String taskId) throws Exception {
        return host.scheduledFrequency(taskId);
    }

    public boolean isActionSchedulerAvailable() {
        return host.isHighCapacity();
    }

    // --- bulk ---

    /** 최초 1회 등록. 태스크별로 실패를 격리한다. */
    public InitialScheduleReport scheduleInitialTasks() {
        List<String> scheduled = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Map<String, String> errors = new LinkedHashMap<>();

        if (!schedulerEnabled()) {
            skipped.addAll(tasks.keySet());
            return new InitialScheduleReport(scheduled, skipped, errors);
        }

        Instant nextRun = calculateNextRunTime();
        for (TaskDefinition def : tasks.values()) {
            String taskId = def.taskId();
            try {
                Frequency frequency = desiredFrequency(def);
                if (!taskEnabled(def) || frequency == Frequency.DISABLED) {
                    skipped.add(taskId);
                    continue;
                }
                if (frequency == null) {
                    errors.put(taskId, "Unknown frequency: " + rawFrequency(def));
                    continue;
                }
                if (schedule(taskId, frequency, nextRun)) {
                    scheduled.add(taskId);
                } else {
                    errors.put(taskId, "Failed to schedule");
                }
            } catch (Exception e) {
                log.warn("initial scheduling failed: taskId={}", taskId, e);
                errors.put(taskId, messageOf(e));
            }
        }

        InitialScheduleReport report = new InitialScheduleReport(scheduled, skipped, errors);
        log.info("initial tasks: scheduled={}, skipped={}, errors={}", scheduled, skipped, errors.keySet());
        return report;
    }

    /** 설정과 실제 스케줄을 비교하여 등록/해제/재등록 */
    public ReconcileReport reconcile() {
        Acc acc = new Acc();

        if (!schedulerEnabled()) {
            for (String taskId : tasks.keySet()) {
                try {
                    if (host.isScheduled(taskId)) {
                        if (unschedule(taskId)) acc.unscheduled.add(taskId);
                        else acc.errors.put(taskId, "Failed to unschedule");
                    }
                } catch (Exception e) {
                    log.warn("reconcile failed: taskId={}", taskId, e);
                    acc.errors.put(taskId, messageOf(e));
                }
            }
            unscheduleOrphans(acc);
            return acc.toReport();
        }

        Instant nextRun = calculateNextRunTime();
        for (TaskDefinition def : tasks.values()) {
            try {
                reconcileTask(def, nextRun, acc);
            } catch (Exception e) {
                log.warn("reconcile failed: taskId={}", def.taskId(), e);
                acc.errors.put(def.taskId(), messageOf(e));
            }
        }
        unscheduleOrphans(acc);

        ReconcileReport report = acc.toReport();
        if (report.hasChanges() || !report.errors().isEmpty()) {
            log.info("schedules reconciled: {}", report);
        }
        return report;
    }

    private void reconcileTask(TaskDefinition def, Instant nextRun, Acc acc) throws Exception {
        String taskId = def.taskId();
        Frequency desired = desiredFrequency(def);
        boolean scheduled = host.isScheduled(taskId);

        if (!taskEnabled(def) || desired == Frequency.DISABLED) {
            if (!scheduled) {
                acc.unchanged.add(taskId);
            } else if (unschedule(taskId)) {
                acc.unscheduled.add(taskId);
            } else {
                acc.errors.put(taskId, "Failed to unschedule");
            }
            return;
        }

        if (desired == null) {
            // 설정 오류: 현재 스케줄은 건드리지 않는다
            acc.errors.put(taskId, "Unknown frequency: " + rawFrequency(def));
            return;
        }

        if (!scheduled) {
            if (schedule(taskId, desired, nextRun)) acc.scheduled.add(taskId);
            else acc.errors.put(taskId, "Failed to schedule");
            return;
        }

        Frequency current = host.scheduledFrequency(taskId).orElse(null);
        if (current != desired) {
            if (reschedule(taskId, desired, nextRun)) acc.rescheduled.add(taskId);
            else acc.errors.put(taskId, "Failed to reschedule");
            return;
        }

        acc.unchanged.add(taskId);
    }

    private void unscheduleOrphans(Acc acc) {
        Map<String, Instant> registered;
        try {
            registered = host.listScheduled();
        } catch (Exception e) {
            log.warn("could not list host schedules", e);
            return;
        }
        for (String taskId : registered.keySet()) {
            if (tasks.containsKey(taskId)) continue;
            try {
                if (unschedule(taskId)) {
                    log.info("orphan schedule removed: taskId={}", taskId);
                    acc.unscheduled.add(taskId);
                } else {
                    acc.errors.put(taskId, "Failed to unschedule");
                }
            } catch (Exception e) {
                log.warn("orphan unschedule failed: taskId={}", taskId, e);
                acc.errors.put(taskId, messageOf(e));
            }
        }
    }

    public Map<String, TaskScheduleStatus> getStatus() throws Exception {
        Map<String, TaskScheduleStatus> out = new LinkedHashMap<>();
        for (TaskDefinition def : tasks.values()) {
            String taskId = def.taskId();
            out.put(taskId, new TaskScheduleStatus(
                    taskId,
                    host.isScheduled(taskId),
                    host.nextRun(taskId).orElse(null),
                    host.scheduledFrequency(taskId).orElse(null),
                    taskEnabled(def),
                    desiredFrequency(def)));
        }
        return out;
    }

    // --- settings ---

    private boolean schedulerEnabled() {
        return settings.getBoolean(SettingsProvider.SCHEDULER_ENABLED, true);
    }

    private boolean taskEnabled(TaskDefinition def) {
        return settings.getBoolean(def.enabledSettingKey(), true);
    }

    /** null = 알 수 없는 값 */
    private Frequency desiredFrequency(TaskDefinition def) {
        return Frequency.from(rawFrequency(def));
    }

    private String rawFrequency(TaskDefinition def) {
        return settings.getString(def.frequencySettingKey(), def.defaultFrequency().code());
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static final class Acc {
        final List<String> scheduled = new ArrayList<>();
        final List<String> unscheduled = new ArrayList<>();
        final List<String> rescheduled = new ArrayList<>();
        final List<String> unchanged = new ArrayList<>();
        final Map<String, String> errors = new LinkedHashMap<>();

        ReconcileReport toReport() {
            return new ReconcileReport(scheduled, unscheduled, rescheduled, unchanged, errors);
        }
    }
}
