package com.feedwatch.monitor;

import com.feedwatch.config.SchedulerProperties;
import com.feedwatch.schedule.ScheduleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Drops statistics of tasks that have not run within the retention period. */
@Component
public class TaskStatsCleanupJob {

    private static final Logger log = LoggerFactory.getLogger(TaskStatsCleanupJob.class);

    private final ScheduleManager scheduleManager;
    private final SchedulerProperties schedulerProperties;

    public TaskStatsCleanupJob(ScheduleManager scheduleManager, SchedulerProperties schedulerProperties) {
        this.scheduleManager = scheduleManager;
        this.schedulerProperties = schedulerProperties;
    }

    @Scheduled(cron = "${feedwatch.scheduler.stats-cleanup-cron:0 0 4 * * *}", zone = "UTC")
    public void cleanup() {
        int retentionDays = schedulerProperties.getStatsRetentionDays();
        int removed = scheduleManager.cleanupTaskStats(retentionDays);
        log.info("Task stats cleanup finished: {} entries removed (retention {} days)", removed, retentionDays);
    }
}
