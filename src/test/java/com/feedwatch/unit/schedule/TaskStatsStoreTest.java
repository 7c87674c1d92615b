package com.feedwatch.unit.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import com.feedwatch.domain.model.TaskKey;
import com.feedwatch.domain.model.TaskStats;
import com.feedwatch.schedule.TaskStatsStore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TaskStatsStoreTest {

    private static final Instant T0 = Instant.parse("2025-03-10T09:00:00Z");

    private MutableClock clock;
    private TaskStatsStore store;

    private final TaskKey acmeMorning = new TaskKey("acme", 0, "09:00");
    private final TaskKey acmeEvening = new TaskKey("acme", 1, "23:00");
    private final TaskKey globexMorning = new TaskKey("globex", 0, "09:00");

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new TaskStatsStore(clock);
    }

    @Nested
    @DisplayName("Recording")
    class Recording {

        @Test
        @DisplayName("Start creates the entry and counts a run")
        void startCreatesEntry() {
            store.recordStart(acmeMorning);

            TaskStats stats = store.get(acmeMorning).orElseThrow();
            assertThat(stats.getTotalRuns()).isEqualTo(1);
            assertThat(stats.getLastRun()).isEqualTo(T0);
            assertThat(stats.getCreatedAt()).isEqualTo(T0);
            assertThat(stats.getSuccessCount()).isZero();
        }

        @Test
        @DisplayName("Settled runs add up to the total")
        void countsAddUp() {
            store.recordStart(acmeMorning);
            store.recordSuccess(acmeMorning);
            clock.advance(Duration.ofDays(1));
            store.recordStart(acmeMorning);
            store.recordFailure(acmeMorning, "timeout");

            TaskStats stats = store.get(acmeMorning).orElseThrow();
            assertThat(stats.getTotalRuns()).isEqualTo(2);
            assertThat(stats.getSuccessCount() + stats.getFailureCount()).isEqualTo(stats.getTotalRuns());
            assertThat(stats.getLastSuccess()).isEqualTo(T0);
            assertThat(stats.getLastFailure()).isEqualTo(T0.plus(Duration.ofDays(1)));
            assertThat(stats.getLastError()).isEqualTo("timeout");
            assertThat(stats.getSuccessRate()).isEqualTo("50.00");
        }

        @Test
        @DisplayName("Unknown task has no stats")
        void unknownTask() {
            assertThat(store.get(acmeMorning)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("Filters by entity and orders by task id")
        void filtersByEntity() {
            store.recordStart(globexMorning);
            store.recordStart(acmeEvening);
            store.recordStart(acmeMorning);

            List<TaskStats> acme = store.getAll("acme");
            assertThat(acme).extracting(TaskStats::getTaskId).containsExactly("acme-0-09:00", "acme-1-23:00");
            assertThat(store.getAll()).hasSize(3);
        }

        @Test
        @DisplayName("Keyed view uses textual task ids")
        void keyedById() {
            store.recordStart(acmeMorning);
            store.recordStart(globexMorning);

            Map<String, TaskStats> all = store.getAllById(null);
            assertThat(all).containsOnlyKeys("acme-0-09:00", "globex-0-09:00");
        }
    }

    @Nested
    @DisplayName("Cleanup")
    class Cleanup {

        @Test
        @DisplayName("Removes entries whose last run is older than the retention")
        void removesStaleEntries() {
            store.recordStart(acmeMorning);
            clock.advance(Duration.ofDays(5));
            store.recordStart(acmeEvening);
            clock.advance(Duration.ofDays(3));

            int removed = store.cleanup(7);

            assertThat(removed).isEqualTo(1);
            assertThat(store.get(acmeMorning)).isEmpty();
            assertThat(store.get(acmeEvening)).isPresent();
        }

        @Test
        @DisplayName("Keeps everything when nothing is stale")
        void keepsFreshEntries() {
            store.recordStart(acmeMorning);
            clock.advance(Duration.ofDays(1));

            assertThat(store.cleanup(7)).isZero();
            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Zero retention removes every entry that has run before now")
        void zeroRetention() {
            store.recordStart(acmeMorning);
            store.recordStart(globexMorning);
            clock.advance(Duration.ofSeconds(1));

            assertThat(store.cleanup(0)).isEqualTo(2);
            assertThat(store.size()).isZero();
        }
    }
}
