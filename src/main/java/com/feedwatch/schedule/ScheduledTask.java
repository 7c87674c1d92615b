package com.feedwatch.schedule;

import com.feedwatch.domain.model.TaskKey;
import com.feedwatch.domain.model.TimeSlot;
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Runtime pairing of one slot with its timer. Armed on {@code start()}, disarmed on
 * {@code stop()}; the pairing itself survives until the entity schedule is removed.
 */
public class ScheduledTask {

    private final TaskKey key;
    private final TimeSlot slot;
    private final Runnable handler;

    private volatile ScheduleHandle handle;
    private volatile Instant lastRun;
    private volatile Instant nextRun;

    /**
     * @param handler invoked with this task on every fire
     */
    public ScheduledTask(TaskKey key, TimeSlot slot, Consumer<ScheduledTask> handler) {
        this.key = key;
        this.slot = slot;
        this.handler = () -> handler.accept(this);
    }

    synchronized void arm(SchedulerPort schedulerPort, Instant now) {
        if (handle != null) {
            return;
        }
        handle = schedulerPort.register(slot, handler);
        nextRun = slot.nextFireAfter(now);
    }

    synchronized void disarm(SchedulerPort schedulerPort) {
        if (handle == null) {
            return;
        }
        schedulerPort.cancel(handle);
        handle = null;
        nextRun = null;
    }

    void markRun(Instant finishedAt) {
        lastRun = finishedAt;
        if (handle != null) {
            nextRun = slot.nextFireAfter(finishedAt);
        }
    }

    public boolean isActive() {
        ScheduleHandle current = handle;
        return current != null && current.isActive();
    }

    public TaskKey getKey() {
        return key;
    }

    public TimeSlot getSlot() {
        return slot;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public Instant getNextRun() {
        return nextRun;
    }
}
