package net.custodian.core.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link SchedulingService#reconcile()} 결과.
 * 등록되지 않은 taskId 의 스케줄(orphan)을 제거한 경우에도 {@code unscheduled} 에 포함된다.
 */
public record ReconcileReport(
        List<String> scheduled,
        List<String> unscheduled,
        List<String> rescheduled,
        List<String> unchanged,
        Map<String, String> errors
) {
    public ReconcileReport {
        scheduled = List.copyOf(scheduled);
        unscheduled = List.copyOf(unscheduled);
        rescheduled = List.copyOf(rescheduled);
        unchanged = List.copyOf(unchanged);
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public boolean hasChanges() {
        return !scheduled.isEmpty() || !unscheduled.isEmpty() || !rescheduled.isEmpty();
    }

    @Override
    public String toString() {
        return "ReconcileReport{" +
                "scheduled=" + scheduled +
                ", unscheduled=" + unscheduled +
                ", rescheduled=" + rescheduled +
                ", unchanged=" + unchanged +
                ", errors=" + errors +
                '}';
    }
}
