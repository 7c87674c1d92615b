package com.feedwatch.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.ToDoubleFunction;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the monitor scheduler.
 *
 * <ul>
 *   <li><b>monitor.task.runs</b> (counter): every RetryExecutor invocation</li>
 *   <li><b>monitor.task.success</b> (counter): invocations that eventually succeeded</li>
 *   <li><b>monitor.task.failure</b> (counter): invocations that settled as failures</li>
 *   <li><b>monitor.task.retries</b> (counter): individual retry attempts (after backoff)</li>
 *   <li><b>monitor.schedule.entities</b> (gauge): entities with a live schedule</li>
 * </ul>
 */
@Service
public class ScheduleMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter runsCounter;
    private final Counter successCounter;
    private final Counter failureCounter;
    private final Counter retriesCounter;

    public ScheduleMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.runsCounter = Counter.builder("monitor.task.runs")
                .description("Monitor task invocations started")
                .register(meterRegistry);
        this.successCounter = Counter.builder("monitor.task.success")
                .description("Monitor task invocations that succeeded, possibly after retries")
                .register(meterRegistry);
        this.failureCounter = Counter.builder("monitor.task.failure")
                .description("Monitor task invocations that failed after exhausting retries")
                .register(meterRegistry);
        this.retriesCounter = Counter.builder("monitor.task.retries")
                .description("Retry attempts performed after a backoff wait")
                .register(meterRegistry);
    }

    /** Binds the entity gauge to its owner; Micrometer evaluates it lazily on scrape. */
    public <T> void registerScheduledEntitiesGauge(T owner, ToDoubleFunction<T> entityCount) {
        Gauge.builder("monitor.schedule.entities", owner, entityCount)
                .description("Entities with a live schedule")
                .register(meterRegistry);
    }

    public void recordRun() {
        runsCounter.increment();
    }

    public void recordSuccess() {
        successCounter.increment();
    }

    public void recordFailure() {
        failureCounter.increment();
    }

    public void recordRetry() {
        retriesCounter.increment();
    }
}
