package com.feedwatch.recovery;

import com.feedwatch.monitor.MonitorCallback;
import com.feedwatch.monitor.MonitorCallbackResolver;
import com.feedwatch.schedule.ScheduleManager;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Creates and starts the monitor schedules once the application is ready.
 *
 * <p>Without a monitor callback the service runs in a degraded mode: the REST surface and
 * statistics work, but nothing is scheduled until one is provided and a reload is issued.
 */
@Component
public class ScheduleStartupRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(ScheduleStartupRunner.class);

    private final ScheduleManager scheduleManager;
    private final MonitorCallbackResolver monitorCallbackResolver;

    public ScheduleStartupRunner(ScheduleManager scheduleManager, MonitorCallbackResolver monitorCallbackResolver) {
        this.scheduleManager = scheduleManager;
        this.monitorCallbackResolver = monitorCallbackResolver;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        Optional<MonitorCallback> callback = monitorCallbackResolver.resolve();
        if (callback.isEmpty()) {
            log.warn("No MonitorCallback or FeedPoller bean found. Monitor scheduling is disabled.");
            return;
        }

        log.info("Startup: initializing monitor schedules...");
        boolean scheduled = scheduleManager.initializeAllSchedules(callback.get());
        if (!scheduled) {
            log.warn("No entity could be scheduled. Check feedwatch.entities and feedwatch.monitor settings.");
        }
        scheduleManager.start();
    }
}
