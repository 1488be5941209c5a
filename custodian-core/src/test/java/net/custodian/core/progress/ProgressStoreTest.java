package net.custodian.core.progress;

import net.custodian.core.spi.OptionStore;
import net.custodian.core.spi.TxRunner;
import net.custodian.core.support.InMemoryOptionStore;
import net.custodian.core.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProgressStoreTest {

    private final MutableClock clock = MutableClock.at("2026-03-10T12:00:00Z");
    private final InMemoryOptionStore options = new InMemoryOptionStore();
    private final ProgressStore root = new ProgressStore(options, TxRunner.direct(), clock);
    private final ProgressStore store = root.forTask("database_cleanup");

    @Test
    void boundToProgressOptionName() throws Exception {
        store.save(Map.of("cursor", 5));

        assertThat(store.optionKey()).isEqualTo("progress_database_cleanup");
        assertThat(options.get("progress_database_cleanup")).isPresent();
    }

    @Test
    void saveStampsSavedAtOnlyWhenAbsent() {
        store.save(Map.of("cursor", 5));
        assertThat(store.getSavedAt()).contains(clock.now());

        store.save(Map.of("cursor", 6, "saved_at", "2026-01-01T00:00:00Z"));
        assertThat(store.getSavedAt()).contains(Instant.parse("2026-01-01T00:00:00Z"));
        assertThat(store.load()).containsEntry("cursor", 6);
    }

    @Test
    void staleBoundary() {
        store.save(Map.of("cursor", 1));

        clock.advanceSeconds(3599);
        assertThat(store.isStale(3600)).isFalse();

        clock.advanceSeconds(1);
        assertThat(store.isStale(3600)).isFalse();   // 정확히 threshold 는 stale 아님

        clock.advanceSeconds(1);
        assertThat(store.isStale(3600)).isTrue();
    }

    @Test
    void missingCheckpointIsStale() {
        assertThat(store.isStale(3600)).isTrue();
        assertThat(store.hasProgress()).isFalse();
    }

    @Test
    void legacyTimestampFormatIsUtc() {
        store.save(Map.of("saved_at", "2026-03-10 11:00:00"));

        assertThat(store.getSavedAt()).contains(Instant.parse("2026-03-10T11:00:00Z"));
        assertThat(store.isStale(3599)).isTrue();
        assertThat(store.isStale(3600)).isFalse();
    }

    @Test
    void unparsableSavedAtIsStale() {
        store.save(Map.of("saved_at", "yesterday"));

        assertThat(store.hasProgress()).isTrue();
        assertThat(store.isStale(1_000_000)).isTrue();
    }

    @Test
    void completedTasksAreUnique() {
        store.addCompletedTask("revisions");
        store.addCompletedTask("transients");
        store.addCompletedTask("revisions");

        assertThat(store.getCompletedTasks()).containsExactly("revisions", "transients");
    }

    @Test
    void errorsAndCountersAccumulate() {
        store.addError("orphans", "table locked");
        store.increment("deleted", 3);
        store.increment("deleted");
        store.update(Map.of("phase", "meta"));

        Map<String, Object> loaded = store.load();
        assertThat(store.getErrors()).containsEntry("orphans", "table locked");
        assertThat(((Number) loaded.get("deleted")).longValue()).isEqualTo(4);
        assertThat(loaded).containsEntry("phase", "meta");
    }

    @Test
    void saveInterruptedMergesErrorsAndStampsTime() {
        store.addError("a", "first");
        Map<String, Object> data = new LinkedHashMap<>(store.load());
        data.put("cursor", 20);

        store.saveInterrupted(data, Map.of("b", "second"));

        assertThat(store.getInterruptedAt()).contains(clock.now());
        assertThat(store.getErrors()).containsEntry("a", "first").containsEntry("b", "second");
        assertThat(store.load()).containsEntry("cursor", 20);
    }

    @Test
    void clearRemovesOnlyThisTask() {
        ProgressStore other = root.forTask("media_scan");
        store.save(Map.of("x", 1));
        other.save(Map.of("y", 2));

        assertThat(store.clear()).isTrue();

        assertThat(store.hasProgress()).isFalse();
        assertThat(other.hasProgress()).isTrue();
    }

    @Test
    void unboundStoreNeverWrites() {
        ProgressStore unbound = root.forTask("");

        assertThat(unbound.isBound()).isFalse();
        assertThat(unbound.save(Map.of("x", 1))).isFalse();
        assertThat(unbound.addError("k", "v")).isFalse();
        assertThat(unbound.clear()).isFalse();
        assertThat(unbound.load()).isEmpty();
        assertThat(options.size()).isZero();
    }

    @Test
    void adminSweep() {
        root.forTask("database_cleanup").save(Map.of("x", 1));
        clock.advanceSeconds(2 * 86400);
        root.forTask("media_scan").saveInterrupted(Map.of("y", 2));
        options.put("unrelated_option", "keep");

        assertThat(root.count()).isEqualTo(2);
        assertThat(root.listAll()).containsExactly("database_cleanup", "media_scan");

        ProgressStatistics stats = root.statistics();
        assertThat(stats.total()).isEqualTo(2);
        assertThat(stats.stale()).isEqualTo(1);
        assertThat(stats.interrupted()).isEqualTo(1);
        assertThat(stats.oldest()).isEqualTo(Instant.parse("2026-03-10T12:00:00Z"));
        assertThat(stats.newest()).isEqualTo(clock.now());

        assertThat(root.pruneStale(86400)).isEqualTo(1);
        assertThat(root.listAll()).containsExactly("media_scan");

        assertThat(root.clearAll()).isEqualTo(1);
        assertThat(root.count()).isZero();
        assertThat(options.get("unrelated_option")).contains("keep");
    }

    @Test
    void checkpointWithoutTimestampIsPruned() {
        options.put("progress_legacy", "{\"cursor\":3}");

        assertThat(root.pruneStale(86400)).isEqualTo(1);
    }

    @Test
    void storageFailureIsSoft() throws Exception {
        OptionStore broken = mock(OptionStore.class);
        when(broken.get(anyString())).thenThrow(new IllegalStateException("db down"));
        doThrow(new IllegalStateException("db down")).when(broken).put(anyString(), anyString());
        when(broken.findByPrefix(anyString())).thenThrow(new IllegalStateException("db down"));
        ProgressStore p = new ProgressStore(broken, TxRunner.direct(), clock).forTask("t");

        assertThat(p.load()).isEmpty();
        assertThat(p.save(Map.of("x", 1))).isFalse();
        assertThat(p.isStale(10)).isTrue();
        assertThat(p.listAll()).isEqualTo(List.of());
    }

    @Test
    void failedReadLeavesCheckpointUntouched() throws Exception {
        store.save(Map.of("cursor", 40, "completed_tasks", List.of("revisions", "drafts")));
        String saved = options.get("progress_database_cleanup").orElseThrow();
        OptionStore flaky = spy(options);
        doThrow(new IllegalStateException("read timeout")).when(flaky).get("progress_database_cleanup");
        ProgressStore p = new ProgressStore(flaky, TxRunner.direct(), clock).forTask("database_cleanup");

        assertThat(p.addError("orphans", "x")).isFalse();
        assertThat(p.addCompletedTask("spam")).isFalse();
        assertThat(p.increment("cleaned", 5)).isFalse();
        assertThat(p.update(Map.of("cursor", 41))).isFalse();

        verify(flaky, never()).put(anyString(), anyString());
        assertThat(options.get("progress_database_cleanup")).contains(saved);
        assertThat(store.load()).containsEntry("cursor", 40);
        assertThat(store.getCompletedTasks()).containsExactly("revisions", "drafts");
    }

    @Test
    void staleComparesFractionalSeconds() {
        store.save(Map.of("cursor", 1));

        clock.advance(Duration.ofSeconds(3600).plusMillis(900));

        assertThat(store.isStale(3600)).isTrue();
    }
}
