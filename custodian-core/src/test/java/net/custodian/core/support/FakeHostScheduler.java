package net.custodian.core.support;

import net.custodian.core.model.Frequency;
import net.custodian.core.spi.HostScheduler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** 발화 없이 등록 상태만 기록하는 HostScheduler */
public final class FakeHostScheduler implements HostScheduler {
    public record Entry(Instant firstRun, Frequency frequency) {}

    private final Map<String, Entry> recurring = new LinkedHashMap<>();
    private final Map<String, Instant> oneShots = new LinkedHashMap<>();

    @Override
    public synchronized boolean schedule(String taskId, Instant firstRun, Frequency frequency) {
        recurring.put(taskId, new Entry(firstRun, frequency));
        return true;
    }

    @Override
    public synchronized boolean scheduleOnce(String taskId, Instant at) {
        oneShots.put(taskId, at);
        return true;
    }

    @Override
    public synchronized boolean unschedule(String taskId) {
        recurring.remove(taskId);
        oneShots.remove(taskId);
        return true;
    }

    @Override
    public synchronized boolean isScheduled(String taskId) {
        return recurring.containsKey(taskId);
    }

    @Override
    public synchronized Optional<Instant> nextRun(String taskId) {
        Entry e = recurring.get(taskId);
        return e == null ? Optional.empty() : Optional.of(e.firstRun());
    }

    @Override
    public synchronized Optional<Frequency> scheduledFrequency(String taskId) {
        Entry e = recurring.get(taskId);
        return e == null ? Optional.empty() : Optional.of(e.frequency());
    }

    @Override
    public synchronized Map<String, Instant> listScheduled() {
        Map<String, Instant> out = new LinkedHashMap<>();
        recurring.forEach((id, e) -> out.put(id, e.firstRun()));
        return out;
    }

    public synchronized Map<String, Instant> oneShots() {
        return new LinkedHashMap<>(oneShots);
    }
}
