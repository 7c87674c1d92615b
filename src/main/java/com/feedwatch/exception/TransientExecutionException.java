package com.feedwatch.exception;

/**
 * Network or upstream failure raised by a monitor callback. Retried by
 * {@link com.feedwatch.schedule.RetryExecutor} according to its backoff policy.
 */
public class TransientExecutionException extends BaseException {

    public TransientExecutionException(String message) {
        super(ErrorCode.TRANSIENT_ERROR, message);
    }

    public TransientExecutionException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_ERROR, message, cause);
    }

    protected TransientExecutionException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
