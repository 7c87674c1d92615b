package com.feedwatch.schedule;

import com.feedwatch.exception.BaseException;

/**
 * Outcome of a single attempt. {@link RetryExecutor} inspects the result to decide
 * between retrying and settling, so exceptions never drive the retry loop itself.
 */
public final class AttemptResult {

    private static final AttemptResult SUCCESS = new AttemptResult(null);

    private final Throwable error;

    private AttemptResult(Throwable error) {
        this.error = error;
    }

    public static AttemptResult success() {
        return SUCCESS;
    }

    public static AttemptResult failure(Throwable error) {
        return new AttemptResult(error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Throwable getError() {
        return error;
    }

    /**
     * Failures are retryable unless the error says otherwise (configuration and parameter
     * errors), the worker thread was interrupted, or the error is a JVM {@link Error}.
     */
    public boolean isRetryable() {
        if (error == null || error instanceof InterruptedException || error instanceof Error) {
            return false;
        }
        if (error instanceof BaseException baseException) {
            return baseException.isRetryable();
        }
        return true;
    }

    public String errorMessage() {
        if (error == null) {
            return null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
