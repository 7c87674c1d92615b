package com.feedwatch.schedule;

import com.feedwatch.domain.model.TaskKey;
import com.feedwatch.domain.model.TaskStats;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory execution counters per task.
 *
 * <p>Not authoritative state: entries live until age-based cleanup or process restart.
 * Each update is an atomic {@code compute} on the map, but two slots of the same task
 * firing in the same instant may still interleave their start/settle records.
 */
@Component
public class TaskStatsStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStatsStore.class);

    private final Map<TaskKey, TaskStats> stats = new ConcurrentHashMap<>();
    private final Clock clock;

    public TaskStatsStore(Clock clock) {
        this.clock = clock;
    }

    public void recordStart(TaskKey key) {
        Instant now = clock.instant();
        stats.compute(key, (k, current) -> orEmpty(k, current, now).started(now));
    }

    public void recordSuccess(TaskKey key) {
        Instant now = clock.instant();
        stats.compute(key, (k, current) -> orEmpty(k, current, now).succeeded(now));
    }

    public void recordFailure(TaskKey key, String errorMessage) {
        Instant now = clock.instant();
        stats.compute(key, (k, current) -> orEmpty(k, current, now).failed(now, errorMessage));
    }

    public Optional<TaskStats> get(TaskKey key) {
        return Optional.ofNullable(stats.get(key));
    }

    public List<TaskStats> getAll() {
        return getAll(null);
    }

    /**
     * Returns snapshots ordered by task id, optionally restricted to one entity.
     *
     * @param entityId entity filter, or null for every task
     */
    public List<TaskStats> getAll(String entityId) {
        return stats.values().stream()
                .filter(s -> entityId == null || s.getKey().belongsTo(entityId))
                .sorted(Comparator.comparing(TaskStats::getTaskId))
                .collect(Collectors.toList());
    }

    /** Same as {@link #getAll(String)} keyed by the textual task id. */
    public Map<String, TaskStats> getAllById(String entityId) {
        Map<String, TaskStats> result = new LinkedHashMap<>();
        for (TaskStats s : getAll(entityId)) {
            result.put(s.getTaskId(), s);
        }
        return result;
    }

    /**
     * Removes entries whose last run predates {@code now - maxAgeDays}. Entries that
     * never ran are kept.
     *
     * @return number of removed entries
     */
    public int cleanup(int maxAgeDays) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(maxAgeDays));
        int removed = 0;
        for (Map.Entry<TaskKey, TaskStats> entry : stats.entrySet()) {
            Instant lastRun = entry.getValue().getLastRun();
            if (lastRun != null && lastRun.isBefore(cutoff) && stats.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Cleaned up {} task stats entries older than {} days", removed, maxAgeDays);
        }
        return removed;
    }

    public int size() {
        return stats.size();
    }

    private static TaskStats orEmpty(TaskKey key, TaskStats current, Instant now) {
        return current != null ? current : TaskStats.empty(key, now);
    }
}
