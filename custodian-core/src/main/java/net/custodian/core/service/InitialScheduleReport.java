package net.custodian.core.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** {@link SchedulingService#scheduleInitialTasks()} 결과. errors 는 taskId → 사유. */
public record InitialScheduleReport(
        List<String> scheduled,
        List<String> skipped,
        Map<String, String> errors
) {
    public InitialScheduleReport {
        scheduled = List.copyOf(scheduled);
        skipped = List.copyOf(skipped);
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
