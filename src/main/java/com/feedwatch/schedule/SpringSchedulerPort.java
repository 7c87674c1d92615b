package com.feedwatch.schedule;

import com.feedwatch.domain.model.TimeSlot;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

/**
 * {@link SchedulerPort} backed by Spring's {@link TaskScheduler} and UTC cron triggers.
 *
 * <p>Each registration is a daily cron evaluated in UTC; cancelling it lets a run that
 * already started finish.
 */
@Component
public class SpringSchedulerPort implements SchedulerPort {

    private static final Logger log = LoggerFactory.getLogger(SpringSchedulerPort.class);

    private final TaskScheduler taskScheduler;

    public SpringSchedulerPort(@Qualifier("monitorTaskScheduler") TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    @Override
    public ScheduleHandle register(TimeSlot slot, Runnable handler) {
        String expression = slot.toCronExpression();
        ScheduledFuture<?> future = taskScheduler.schedule(handler, new CronTrigger(expression, ZoneOffset.UTC));
        if (future == null) {
            throw new IllegalStateException("Cron expression never fires: " + expression);
        }
        log.debug("Registered timer {} (cron '{}', UTC)", slot.label(), expression);
        return new FutureHandle(future);
    }

    @Override
    public void cancel(ScheduleHandle handle) {
        if (handle instanceof FutureHandle futureHandle) {
            // In-flight runs are allowed to finish
            futureHandle.future.cancel(false);
        }
    }

    private static final class FutureHandle implements ScheduleHandle {

        private final ScheduledFuture<?> future;

        private FutureHandle(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean isActive() {
            return !future.isCancelled() && !future.isDone();
        }
    }
}
