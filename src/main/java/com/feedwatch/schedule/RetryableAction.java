package com.feedwatch.schedule;

/** One attempt of work executed under {@link RetryExecutor}. */
@FunctionalInterface
public interface RetryableAction {

    void run() throws Exception;
}
