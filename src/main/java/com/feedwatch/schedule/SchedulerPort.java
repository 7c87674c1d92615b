package com.feedwatch.schedule;

import com.feedwatch.domain.model.TimeSlot;

/**
 * Timer abstraction used by {@link ScheduleManager}.
 *
 * <p>Each registration fires {@code handler} every day at the slot's UTC time until
 * cancelled. Handlers of different registrations may run concurrently. Cancelling
 * never interrupts a handler that is already running.
 */
public interface SchedulerPort {

    ScheduleHandle register(TimeSlot slot, Runnable handler);

    void cancel(ScheduleHandle handle);
}
