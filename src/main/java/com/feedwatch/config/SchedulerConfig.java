package com.feedwatch.config;

import com.feedwatch.schedule.RetryOptions;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Timer pool, clock and default retry policy for the monitor scheduler.
 *
 * <p>Monitor tasks run on the {@code monitorTaskScheduler} pool, which is also the only
 * {@code TaskScheduler} in the context and therefore serves {@code @Scheduled} jobs.
 * Backoff sleeps hold a pool thread, so {@code pool-size} bounds how many slots may be
 * retrying at the same time.
 */
@Configuration
@EnableConfigurationProperties({MonitorProperties.class, SchedulerProperties.class, EntityProperties.class})
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean("monitorTaskScheduler")
    public ThreadPoolTaskScheduler monitorTaskScheduler(SchedulerProperties schedulerProperties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, schedulerProperties.getPoolSize()));
        scheduler.setThreadNamePrefix("monitor-");
        scheduler.setErrorHandler(t -> log.error("Unhandled error in monitor task: {}", t.getMessage(), t));
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(10);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Default retry policy; invalid values fail the startup. */
    @Bean
    public RetryOptions defaultRetryOptions(SchedulerProperties schedulerProperties) {
        SchedulerProperties.Retry retry = schedulerProperties.getRetry();
        RetryOptions options =
                new RetryOptions(retry.getMaxRetries(), retry.getInitialDelayMs(), retry.getBackoffMultiplier());
        log.info(
                "Retry policy: maxRetries={}, initialDelayMs={}, backoffMultiplier={}",
                options.maxRetries(),
                options.initialDelayMs(),
                options.backoffMultiplier());
        return options;
    }
}
