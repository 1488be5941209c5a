package net.custodian.core.maintenance;

import net.custodian.core.progress.ProgressStore;
import net.custodian.core.service.ReconcileReport;
import net.custodian.core.service.SchedulingService;
import net.custodian.core.spi.Clock;

import java.time.Duration;
import java.time.Instant;

public final class MaintenanceService {
    private final ProgressStore progress;
    private final SchedulingService scheduling;
    private final Clock clock;

    public MaintenanceService(ProgressStore progress,
                              SchedulingService scheduling,
                              Clock clock) {
        this.progress = progress;
        this.scheduling = scheduling;
        this.clock = clock;
    }

    /**
     * 주기 점검 메인 루틴.
     * - 방치된 체크포인트 정리 (staleAfter 보다 오래된 것)
     * - 설정 대비 호스트 스케줄 보정
     */
    public MaintenanceReport runOnce(Duration staleAfter) {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        // 1) stale 체크포인트 정리 (null/0 이면 건너뜀)
        if (staleAfter != null && !staleAfter.isZero() && !staleAfter.isNegative()) {
            r.prunedCheckpoints = progress.pruneStale(staleAfter.getSeconds());
        }
        r.remainingCheckpoints = progress.count();

        // 2) 스케줄 보정
        ReconcileReport rec = scheduling.reconcile();
        r.scheduled = rec.scheduled().size();
        r.unscheduled = rec.unscheduled().size();
        r.rescheduled = rec.rescheduled().size();
        r.errors = rec.errors().size();

        r.timestamp = now;
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public int prunedCheckpoints;
        public int remainingCheckpoints;
        public int scheduled;
        public int unscheduled;
        public int rescheduled;
        public int errors;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", prunedCheckpoints=" + prunedCheckpoints +
                    ", remainingCheckpoints=" + remainingCheckpoints +
                    ", scheduled=" + scheduled +
                    ", unscheduled=" + unscheduled +
                    ", rescheduled=" + rescheduled +
                    ", errors=" + errors +
                    '}';
        }
    }
}
