package net.custodian.core.model;

import java.util.List;
import java.util.Objects;

public record TaskDefinition(
        String taskId,
        String enabledSettingKey,
        String frequencySettingKey,
        Frequency defaultFrequency
) {
    public TaskDefinition {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(enabledSettingKey, "enabledSettingKey");
        Objects.requireNonNull(frequencySettingKey, "frequencySettingKey");
        Objects.requireNonNull(defaultFrequency, "defaultFrequency");
    }

    public static final TaskDefinition DATABASE_CLEANUP = new TaskDefinition(
            "database_cleanup", "enable_scheduled_db_cleanup", "database_cleanup_frequency", Frequency.WEEKLY);
    public static final TaskDefinition MEDIA_SCAN = new TaskDefinition(
            "media_scan", "enable_scheduled_media_scan", "media_scan_frequency", Frequency.WEEKLY);
    public static final TaskDefinition PERFORMANCE_CHECK = new TaskDefinition(
            "performance_check", "enable_scheduled_performance_check", "performance_check_frequency", Frequency.DAILY);

    public static List<TaskDefinition> builtIn() {
        return List.of(DATABASE_CLEANUP, MEDIA_SCAN, PERFORMANCE_CHECK);
    }
}
