package com.feedwatch.schedule;

/** A registered timer returned by {@link SchedulerPort#register}. */
public interface ScheduleHandle {

    /** True while the timer is armed and will fire again. */
    boolean isActive();
}
