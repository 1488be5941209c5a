package net.custodian.bootstrap.schedule;

import net.custodian.core.execution.TaskExecutor;
import net.custodian.core.service.InitialScheduleReport;
import net.custodian.core.service.SchedulingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/** 기동 시 1회: 알려진 태스크를 선호 시각에 등록 */
public class InitialScheduleRegistrar {
    private static final Logger log = LoggerFactory.getLogger(InitialScheduleRegistrar.class);

    private final SchedulingService scheduling;
    private final TaskExecutor executor;

    public InitialScheduleRegistrar(SchedulingService scheduling, TaskExecutor executor) {
        this.scheduling = scheduling;
        this.executor = executor;
    }

    public InitialScheduleReport register() {
        // 구현 빈이 없는 태스크는 발화해도 "unknown task id" 로 끝난다. 등록은 하되 알려준다
        Set<String> missing = new HashSet<>(scheduling.getKnownTaskIds());
        missing.removeAll(executor.registeredTaskIds());
        if (!missing.isEmpty()) {
            log.warn("no ScheduledTask bean for: {}", missing);
        }

        InitialScheduleReport report = scheduling.scheduleInitialTasks();
        if (report.hasErrors()) {
            log.warn("Initial schedule finished with errors: {}", report.errors());
        } else {
            log.info("Initial schedule registered: scheduled={} skipped={}", report.scheduled(), report.skipped());
        }
        return report;
    }
}
