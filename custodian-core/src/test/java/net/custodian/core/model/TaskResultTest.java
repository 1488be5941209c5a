package net.custodian.core.model;

import net.custodian.core.support.Json;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskResultTest {

    private final TaskResult base = TaskResult.success("database_cleanup", 10, 4, 2048, 1.5);

    @Test
    void mutatorsReturnNewInstanceAndLeaveOriginalUntouched() {
        TaskResult patched = base.with(TaskResult.patch().success(false).itemsFound(99));
        TaskResult counted = base.addCounts(1, 2, 3);
        TaskResult errored = base.addError("orphans", "table locked");

        assertThat(base.success()).isTrue();
        assertThat(base.itemsFound()).isEqualTo(10);
        assertThat(base.errors()).isEmpty();

        assertThat(patched.success()).isFalse();
        assertThat(patched.itemsFound()).isEqualTo(99);
        assertThat(patched.itemsCleaned()).isEqualTo(4);
        assertThat(counted).isNotSameAs(base);
        assertThat(errored.errors()).containsEntry("orphans", "table locked");
    }

    @Test
    void patchCanClearNullableFields() {
        TaskResult paused = TaskResult.interrupted("media_scan", 50, 20, 0,
                Map.of("cursor", "slow"), Instant.parse("2026-03-10T12:01:00Z"), 20.0);

        TaskResult done = paused.with(TaskResult.patch().interrupted(false).nextRun(null).errors(null));

        assertThat(done.interrupted()).isFalse();
        assertThat(done.nextRun()).isNull();
        assertThat(done.errors()).isEmpty();
        assertThat(done.executedAt()).isEqualTo(paused.executedAt());
        assertThat(paused.nextRun()).isEqualTo(Instant.parse("2026-03-10T12:01:00Z"));
        assertThat(paused.with(TaskResult.patch()).nextRun()).isEqualTo(paused.nextRun());
    }

    @Test
    void addCountsAddsComponentWise() {
        TaskResult r = base.addCounts(5, 6, 7);

        assertThat(r.itemsFound()).isEqualTo(15);
        assertThat(r.itemsCleaned()).isEqualTo(10);
        assertThat(r.bytesFreed()).isEqualTo(2055);
        assertThat(base.addCounts(2).itemsFound()).isEqualTo(12);
        assertThat(base.addCounts()).isEqualTo(base);
    }

    @Test
    void errorsKeepInsertionOrderAndAreReadOnly() {
        TaskResult r = base.addError("b", "2").addError("a", "1");

        assertThat(r.errors().keySet()).containsExactly("b", "a");
        assertThat(r.hasErrors()).isTrue();
        assertThatThrownBy(() -> r.errors().put("c", "3")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void negativeCountsAreRejected() {
        assertThatThrownBy(() -> TaskResult.success("t", -1, 0, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> base.with(TaskResult.patch().elapsedTime(-0.1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cleanedAboveFoundIsAllowed() {
        assertThat(TaskResult.success("t", 1, 5, 0, 0).itemsCleaned()).isEqualTo(5);
    }

    @Test
    void mapRoundTripKeepsEveryField() throws Exception {
        TaskResult r = TaskResult.interrupted("media_scan", 50, 20, 4096,
                Map.of("thumb", "missing file"), Instant.parse("2026-03-10T02:01:00Z"), 21.25);

        assertThat(TaskResult.fromMap(r.toMap())).isEqualTo(r);
        // JSON 을 거치면 숫자가 Integer 로 돌아온다
        assertThat(TaskResult.fromMap(Json.readMap(Json.write(r.toMap())))).isEqualTo(r);
    }

    @Test
    void toMapWritesBothInterruptionAliases() {
        Map<String, Object> m = TaskResult.interrupted("t", 1, 1, 0, Map.of(), null, 0).toMap();

        assertThat(m).containsEntry("interrupted", true).containsEntry("was_interrupted", true);
    }

    @Test
    void fromMapAcceptsLegacyShape() {
        Map<String, Object> legacy = new LinkedHashMap<>();
        legacy.put("success", true);
        legacy.put("items_cleaned", 7);
        legacy.put("was_interrupted", "1");
        legacy.put("executed_at", "not a date");

        TaskResult r = TaskResult.fromMap(legacy);

        assertThat(r.interrupted()).isTrue();
        assertThat(r.itemsFound()).isEqualTo(7);
        assertThat(r.executedAt()).isNull();
        assertThat(r.taskId()).isEmpty();
    }
}
