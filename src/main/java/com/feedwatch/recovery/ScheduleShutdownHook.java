package com.feedwatch.recovery;

import com.feedwatch.schedule.ScheduleManager;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Cancels every monitor timer when the context closes.
 *
 * <p>Runs in a high {@link SmartLifecycle} phase so the timers are gone before the task
 * scheduler pool is shut down. In-flight runs are not interrupted.
 */
@Service
public class ScheduleShutdownHook implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ScheduleShutdownHook.class);

    private final ScheduleManager scheduleManager;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public ScheduleShutdownHook(ScheduleManager scheduleManager) {
        this.scheduleManager = scheduleManager;
    }

    @Override
    public void start() {
        running.set(true);
    }

    @Override
    public void stop() {
        try {
            if (scheduleManager.stop()) {
                log.info("Monitor schedules stopped for shutdown");
            }
        } catch (Exception e) {
            log.error("Error while stopping monitor schedules", e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Higher phase stops earlier
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
