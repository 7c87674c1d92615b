package com.feedwatch.schedule;

import com.feedwatch.domain.model.TaskKey;
import com.feedwatch.observability.ScheduleMetrics;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one task invocation with bounded retry and exponential backoff.
 *
 * <p>Built on a Resilience4j {@link Retry} created per invocation from {@link RetryOptions}:
 * <ul>
 *   <li>every attempt is converted into an {@link AttemptResult}; the retry decision is
 *       taken on that result ({@code retryOnResult}), not on a thrown exception</li>
 *   <li>waits follow {@link IntervalFunction#ofExponentialBackoff(long, double)} with no
 *       jitter, so the n-th retry waits exactly {@code initialDelayMs * multiplier^(n-1)}</li>
 *   <li>configuration and parameter errors are settled immediately, without retry</li>
 *   <li>a {@link Error} thrown by the action is settled as a failure without retry</li>
 * </ul>
 *
 * <p>When the invocation fails, the error of the last attempt is rethrown unchanged.
 *
 * <p>Statistics contract: exactly one start record precedes the first attempt and exactly
 * one success or failure record settles the invocation. Attempts of one invocation run
 * sequentially on the caller's thread, each retry waiting for its backoff first.
 *
 * <p>Each invocation registers its Retry in the shared {@link RetryRegistry} under
 * {@code {taskId}#{sequence}} and removes it when settled, so registry listeners can
 * observe retry events.
 */
@Component
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryRegistry retryRegistry;
    private final TaskStatsStore taskStatsStore;
    private final ScheduleMetrics scheduleMetrics;
    private final RetryOptions defaultOptions;

    private final AtomicLong invocationSequence = new AtomicLong();

    public RetryExecutor(
            RetryRegistry retryRegistry,
            TaskStatsStore taskStatsStore,
            ScheduleMetrics scheduleMetrics,
            RetryOptions defaultOptions) {
        this.retryRegistry = retryRegistry;
        this.taskStatsStore = taskStatsStore;
        this.scheduleMetrics = scheduleMetrics;
        this.defaultOptions = defaultOptions;
    }

    public void run(TaskKey key, RetryableAction action) throws Exception {
        run(key, action, defaultOptions);
    }

    /**
     * Executes {@code action} until it succeeds or the retry budget is spent.
     *
     * @throws Exception the error of the last attempt, once retries are exhausted or
     *                   as soon as a non-retryable error occurs
     */
    public void run(TaskKey key, RetryableAction action, RetryOptions options) throws Exception {
        String taskId = key.toString();
        String retryName = taskId + "#" + invocationSequence.incrementAndGet();
        AtomicInteger attempts = new AtomicInteger();

        taskStatsStore.recordStart(key);
        scheduleMetrics.recordRun();

        Retry retry = retryRegistry.retry(retryName, retryConfig(options));
        retry.getEventPublisher().onRetry(event -> {
            scheduleMetrics.recordRetry();
            log.info(
                    "Retrying task {} ({}/{}) in {} ms",
                    taskId,
                    event.getNumberOfRetryAttempts(),
                    options.maxRetries(),
                    event.getWaitInterval().toMillis());
        });

        AttemptResult result;
        try {
            result = retry.executeSupplier(() -> attempt(taskId, action, attempts.incrementAndGet(), options));
        } catch (RuntimeException e) {
            // Raised when the backoff sleep is interrupted
            result = AttemptResult.failure(e);
        } catch (Error e) {
            result = AttemptResult.failure(e);
        } finally {
            retryRegistry.remove(retryName);
        }

        if (result.isSuccess()) {
            taskStatsStore.recordSuccess(key);
            scheduleMetrics.recordSuccess();
            if (attempts.get() > 1) {
                log.info("Task {} succeeded on attempt {}", taskId, attempts.get());
            }
            return;
        }

        taskStatsStore.recordFailure(key, result.errorMessage());
        scheduleMetrics.recordFailure();

        if (result.isRetryable()) {
            log.error("Task {} failed after {} attempts: {}", taskId, attempts.get(), result.errorMessage());
        } else {
            log.error("Task {} failed with non-retryable error: {}", taskId, result.errorMessage());
        }
        Throwable error = result.getError();
        if (error instanceof Error fatal) {
            throw fatal;
        }
        throw (Exception) error;
    }

    private AttemptResult attempt(String taskId, RetryableAction action, int attempt, RetryOptions options) {
        try {
            action.run();
            return AttemptResult.success();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Task {} interrupted on attempt {}", taskId, attempt);
            return AttemptResult.failure(e);
        } catch (Exception e) {
            log.warn("Task {} attempt {}/{} failed: {}", taskId, attempt, options.maxAttempts(), e.getMessage());
            return AttemptResult.failure(e);
        }
    }

    private RetryConfig retryConfig(RetryOptions options) {
        return RetryConfig.<AttemptResult>custom()
                .maxAttempts(options.maxAttempts())
                .intervalFunction(
                        IntervalFunction.ofExponentialBackoff(options.initialDelayMs(), options.backoffMultiplier()))
                .retryOnResult(result -> !result.isSuccess() && result.isRetryable())
                .build();
    }
}
