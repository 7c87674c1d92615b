package com.feedwatch.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Execution counters of one task. Immutable: every update produces a new snapshot,
 * so readers never observe a half-applied change.
 *
 * <p>{@code totalRuns == successCount + failureCount} once every started run has settled.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class TaskStats {

    private final TaskKey key;

    private final long totalRuns;

    private final long successCount;

    private final long failureCount;

    private final Instant lastRun;

    private final Instant lastSuccess;

    private final Instant lastFailure;

    private final String lastError;

    private final Instant createdAt;

    public static TaskStats empty(TaskKey key, Instant createdAt) {
        return TaskStats.builder().key(key).createdAt(createdAt).build();
    }

    public TaskStats started(Instant at) {
        return toBuilder().totalRuns(totalRuns + 1).lastRun(at).build();
    }

    public TaskStats succeeded(Instant at) {
        return toBuilder().successCount(successCount + 1).lastSuccess(at).build();
    }

    public TaskStats failed(Instant at, String error) {
        return toBuilder()
                .failureCount(failureCount + 1)
                .lastFailure(at)
                .lastError(error)
                .build();
    }

    /** Percentage of successful runs with two decimals, "0.00" before the first run. */
    public String getSuccessRate() {
        if (totalRuns == 0) {
            return "0.00";
        }
        return BigDecimal.valueOf(successCount * 100L)
                .divide(BigDecimal.valueOf(totalRuns), 2, RoundingMode.HALF_UP)
                .toPlainString();
    }

    public String getTaskId() {
        return key.toString();
    }
}
