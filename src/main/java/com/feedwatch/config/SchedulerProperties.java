package com.feedwatch.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "feedwatch.scheduler")
@Getter
@Setter
public class SchedulerProperties {

    /** Threads of the monitor timer pool. */
    private int poolSize = 4;

    /** Days a task's statistics survive without a new run. */
    private int statsRetentionDays = 7;

    /** When the statistics cleanup runs (six-field cron, UTC). */
    private String statsCleanupCron = "0 0 4 * * *";

    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Retry {

        private int maxRetries = 3;

        private long initialDelayMs = 5000;

        private double backoffMultiplier = 2.0;
    }
}
