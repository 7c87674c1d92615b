package com.feedwatch.schedule;

import com.feedwatch.domain.enums.ScheduleMode;
import com.feedwatch.domain.model.MonitorSettings;
import com.feedwatch.domain.model.MonitoredEntity;
import com.feedwatch.domain.model.ScheduleEntity;
import com.feedwatch.domain.model.TaskKey;
import com.feedwatch.domain.model.TaskStats;
import com.feedwatch.domain.model.TimeSlot;
import com.feedwatch.exception.BaseException;
import com.feedwatch.exception.ConfigurationException;
import com.feedwatch.monitor.EntityConfigPort;
import com.feedwatch.monitor.MonitorCallback;
import com.feedwatch.observability.ScheduleMetrics;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the per-entity sets of scheduled monitor tasks and their lifecycle.
 *
 * <p>For every monitored entity the manager asks {@link TimeSlotAllocator} for the day's
 * slots, registers one timer per slot through {@link SchedulerPort}, and on each fire runs
 * the monitor callback for the slot's pre-assigned credential through {@link RetryExecutor}
 * (which also keeps {@link TaskStatsStore} up to date).
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>{@link #createEntitySchedule} builds (or rebuilds) one entity's tasks; they are armed
 *       immediately when the manager is running, otherwise on the next {@link #start()}</li>
 *   <li>{@link #start()}/{@link #stop()} arm and disarm every registered task and return
 *       false when the manager is already in the requested state</li>
 *   <li>{@link #reload} stops, recomputes every entity from configuration, and starts again</li>
 * </ul>
 *
 * <p>Failure isolation: no public method throws. An entity with broken configuration is
 * logged and skipped, a failing slot is recorded as a failure and stays scheduled for its
 * next natural fire time.
 *
 * <p>Concurrency: handlers of different slots may overlap on the scheduler pool, including
 * two slots of the same entity under clock drift; nothing serializes them. The running flag
 * gates start/stop but is not a mutex, so lifecycle calls are expected from a single owner.
 * Stopping cancels pending timers but lets in-flight retry loops finish.
 */
@Service
public class ScheduleManager {

    private static final Logger log = LoggerFactory.getLogger(ScheduleManager.class);

    private final TimeSlotAllocator timeSlotAllocator;
    private final SchedulerPort schedulerPort;
    private final RetryExecutor retryExecutor;
    private final TaskStatsStore taskStatsStore;
    private final EntityConfigPort entityConfigPort;
    private final Clock clock;

    private final Map<String, EntitySchedule> schedules = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ScheduleManager(
            TimeSlotAllocator timeSlotAllocator,
            SchedulerPort schedulerPort,
            RetryExecutor retryExecutor,
            TaskStatsStore taskStatsStore,
            EntityConfigPort entityConfigPort,
            ScheduleMetrics scheduleMetrics,
            Clock clock) {
        this.timeSlotAllocator = timeSlotAllocator;
        this.schedulerPort = schedulerPort;
        this.retryExecutor = retryExecutor;
        this.taskStatsStore = taskStatsStore;
        this.entityConfigPort = entityConfigPort;
        this.clock = clock;
        scheduleMetrics.registerScheduledEntitiesGauge(this, ScheduleManager::getEntityCount);
    }

    /**
     * Computes the slots of one entity and registers a task per slot, replacing any
     * schedule the entity already had.
     *
     * @return false if the entity could not be scheduled; other entities are unaffected
     */
    public boolean createEntitySchedule(String entityId, MonitorCallback monitorCallback) {
        try {
            Objects.requireNonNull(monitorCallback, "monitorCallback");
            MonitoredEntity entity = entityConfigPort
                    .getEntityById(entityId)
                    .orElseThrow(() -> new ConfigurationException("Unknown monitored entity: " + entityId));
            if (entity.getCredentials().isEmpty()) {
                throw new ConfigurationException("Entity " + entityId + " has no API credentials configured");
            }

            MonitorSettings settings = entityConfigPort.loadMonitorSettings();
            Instant now = clock.instant();
            List<TimeSlot> slots = timeSlotAllocator.allocate(entity.getCredentialCount(), settings, now);
            if (slots.isEmpty()) {
                throw new ConfigurationException("No trigger slots could be allocated for entity " + entityId);
            }

            ZoneId windowZone = settings.getWindowZone() != null ? settings.getWindowZone() : ZoneOffset.UTC;
            logSlots(entityId, settings.getMode(), windowZone, slots);

            stopEntitySchedule(entityId);

            List<ScheduledTask> tasks = new ArrayList<>(slots.size());
            Set<TaskKey> keys = new HashSet<>();
            for (int i = 0; i < slots.size(); i++) {
                TimeSlot slot = slots.get(i);
                TaskKey key = TaskKey.of(entityId, slot);
                if (!keys.add(key)) {
                    // Budget exceeds the minutes in the window: floored slots share a minute
                    key = TaskKey.of(entityId, slot, i);
                    keys.add(key);
                    log.warn("Entity {} has two slots at {} for credential {}; tracking the later one as {}",
                            entityId, slot.label(), slot.getCredentialIndex(), key);
                }
                tasks.add(new ScheduledTask(
                        key, slot, task -> fire(task, windowZone, monitorCallback)));
            }

            if (running.get()) {
                armAll(entityId, tasks, now);
            }

            ScheduleEntity scheduleEntity = ScheduleEntity.builder()
                    .entityId(entityId)
                    .credentialCount(entity.getCredentialCount())
                    .slots(slots)
                    .createdAt(now)
                    .build();
            schedules.put(entityId, new EntitySchedule(scheduleEntity, List.copyOf(tasks)));

            log.info("Schedule for entity {} created with {} slots", entityId, slots.size());
            return true;

        } catch (BaseException e) {
            log.warn("Cannot schedule entity {}: {}", entityId, e.getMessage());
            return false;
        } catch (Exception e) {
            log.error("Failed to create schedule for entity {}", entityId, e);
            return false;
        }
    }

    /** Cancels and forgets every task of the entity. No-op if the entity has no schedule. */
    public void stopEntitySchedule(String entityId) {
        EntitySchedule removed = schedules.remove(entityId);
        if (removed == null) {
            return;
        }
        removed.tasks().forEach(task -> disarmQuietly(task));
        log.info("Schedule for entity {} stopped ({} tasks)", entityId, removed.tasks().size());
    }

    /**
     * Creates schedules for every monitored entity whose monitoring is enabled.
     *
     * @return true if at least one entity was scheduled
     */
    public boolean initializeAllSchedules(MonitorCallback monitorCallback) {
        List<String> entityIds;
        try {
            entityIds = entityConfigPort.getMonitoredEntityIds();
        } catch (Exception e) {
            log.error("Failed to load monitored entities", e);
            return false;
        }

        log.info("Initializing schedules for {} entities", entityIds.size());
        int scheduled = 0;
        for (String entityId : entityIds) {
            if (!isMonitoringEnabled(entityId)) {
                log.info("Skipping disabled entity {}", entityId);
                continue;
            }
            if (createEntitySchedule(entityId, monitorCallback)) {
                scheduled++;
            }
        }
        log.info("Schedule initialization finished: {}/{} entities scheduled", scheduled, entityIds.size());
        return scheduled > 0;
    }

    /** Arms every registered task. Returns false if the manager was already running. */
    public boolean start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Schedule manager already running");
            return false;
        }
        Instant now = clock.instant();
        int armed = 0;
        for (Map.Entry<String, EntitySchedule> entry : schedules.entrySet()) {
            for (ScheduledTask task : entry.getValue().tasks()) {
                try {
                    task.arm(schedulerPort, now);
                    armed++;
                } catch (Exception e) {
                    log.error("Failed to arm task {}", task.getKey(), e);
                }
            }
        }
        log.info("Schedule manager started: {} tasks across {} entities", armed, schedules.size());
        return true;
    }

    /**
     * Disarms every task while keeping the entity registrations, so a later
     * {@link #start()} restores the same slots. Returns false if already stopped.
     */
    public boolean stop() {
        if (!running.compareAndSet(true, false)) {
            log.debug("Schedule manager not running");
            return false;
        }
        int disarmed = 0;
        for (EntitySchedule schedule : schedules.values()) {
            for (ScheduledTask task : schedule.tasks()) {
                disarmQuietly(task);
                disarmed++;
            }
        }
        log.info("Schedule manager stopped: {} tasks cancelled", disarmed);
        return true;
    }

    /**
     * Stops, recomputes every entity schedule from current configuration, and starts again.
     * Used when the set of monitored entities or their credentials change.
     *
     * @return true if at least one entity was scheduled
     */
    public boolean reload(MonitorCallback monitorCallback) {
        log.info("Reloading schedules...");
        stop();
        new ArrayList<>(schedules.keySet()).forEach(this::stopEntitySchedule);

        boolean scheduled = initializeAllSchedules(monitorCallback);
        start();

        if (scheduled) {
            log.info("Schedules reloaded");
        } else {
            log.error("Schedule reload finished without any scheduled entity");
        }
        return scheduled;
    }

    /**
     * Runs the callback once for the given entity and credential through the normal
     * retry path, bypassing the clock. Used for operator re-runs.
     *
     * @return true if the run succeeded
     */
    public boolean manualTrigger(String entityId, int credentialIndex, MonitorCallback monitorCallback) {
        if (monitorCallback == null || credentialIndex < 0) {
            log.warn("Rejected manual trigger for entity {} (credentialIndex={})", entityId, credentialIndex);
            return false;
        }
        EntitySchedule schedule = schedules.get(entityId);
        if (schedule != null && credentialIndex >= schedule.entity().getCredentialCount()) {
            log.warn(
                    "Rejected manual trigger for entity {}: credential index {} out of range (count={})",
                    entityId,
                    credentialIndex,
                    schedule.entity().getCredentialCount());
            return false;
        }

        log.info("Manual trigger [entity={}, credentialIndex={}]", entityId, credentialIndex);
        try {
            retryExecutor.run(
                    TaskKey.manual(entityId, credentialIndex),
                    () -> monitorCallback.monitor(entityId, credentialIndex));
            log.info("Manual trigger for entity {} completed", entityId);
            return true;
        } catch (Throwable t) {
            log.error("Manual trigger for entity {} failed: {}", entityId, t.toString());
            return false;
        }
    }

    public ScheduleStatus getStatus() {
        Map<String, ScheduleStatus.EntityStatus> entities = new LinkedHashMap<>();
        int activeTasks = 0;
        for (String entityId : sortedEntityIds()) {
            EntitySchedule schedule = schedules.get(entityId);
            if (schedule == null) {
                continue;
            }
            ScheduleEntity entity = schedule.entity();
            long active = schedule.tasks().stream().filter(ScheduledTask::isActive).count();
            activeTasks += (int) active;
            entities.put(
                    entityId,
                    ScheduleStatus.EntityStatus.builder()
                            .credentialCount(entity.getCredentialCount())
                            .slotCount(entity.getSlots().size())
                            .slots(entity.getSlots().stream().map(TimeSlot::label).collect(Collectors.toList()))
                            .credentialIndexes(entity.getSlots().stream()
                                    .map(TimeSlot::getCredentialIndex)
                                    .collect(Collectors.toList()))
                            .active(active > 0)
                            .createdAt(entity.getCreatedAt())
                            .nextRun(schedule.tasks().stream()
                                    .map(ScheduledTask::getNextRun)
                                    .filter(Objects::nonNull)
                                    .min(Comparator.naturalOrder())
                                    .orElse(null))
                            .build());
        }
        return ScheduleStatus.builder()
                .running(running.get())
                .totalEntities(entities.size())
                .activeTasks(activeTasks)
                .entities(entities)
                .build();
    }

    /**
     * Task statistics keyed by textual task id.
     *
     * @param entityId restricts the result to one entity, or null for all
     */
    public Map<String, TaskStats> getTaskStats(String entityId) {
        return taskStatsStore.getAllById(entityId);
    }

    public int cleanupTaskStats(int daysToKeep) {
        return taskStatsStore.cleanup(daysToKeep);
    }

    /**
     * Upcoming fire time of every slot, per entity, sorted ascending. Slots already past
     * today are reported for tomorrow.
     *
     * @param entityId restricts the result to one entity, or null for all
     */
    public Map<String, List<NextExecution>> getNextExecutions(String entityId) {
        Instant now = clock.instant();
        Map<String, List<NextExecution>> result = new LinkedHashMap<>();
        for (String id : sortedEntityIds()) {
            if (entityId != null && !entityId.equals(id)) {
                continue;
            }
            EntitySchedule schedule = schedules.get(id);
            if (schedule == null) {
                continue;
            }
            List<NextExecution> next = schedule.entity().getSlots().stream()
                    .map(slot -> new NextExecution(slot.nextFireAfter(now), slot.label(), slot.getCredentialIndex()))
                    .sorted(Comparator.comparing(NextExecution::at))
                    .collect(Collectors.toList());
            result.put(id, next);
        }
        return result;
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getEntityCount() {
        return schedules.size();
    }

    /** Tasks currently registered for an entity, in slot order. */
    public List<ScheduledTask> getTasks(String entityId) {
        EntitySchedule schedule = schedules.get(entityId);
        return schedule != null ? schedule.tasks() : List.of();
    }

    private void fire(ScheduledTask task, ZoneId windowZone, MonitorCallback monitorCallback) {
        TaskKey key = task.getKey();
        TimeSlot slot = task.getSlot();
        log.info(
                "Triggering monitor task [entity={}, time={} UTC / {} {}, credentialIndex={}]",
                key.entityId(),
                slot.label(),
                slot.labelIn(windowZone),
                windowZone,
                slot.getCredentialIndex());
        try {
            retryExecutor.run(key, () -> monitorCallback.monitor(key.entityId(), slot.getCredentialIndex()));
        } catch (Throwable t) {
            // Already recorded as a failure; the slot stays scheduled for its next fire time
            log.error("Monitor task {} failed: {}", key, t.toString());
        } finally {
            task.markRun(clock.instant());
        }
    }

    private boolean isMonitoringEnabled(String entityId) {
        try {
            return entityConfigPort.isEntityMonitoringEnabled(entityId);
        } catch (Exception e) {
            log.warn("Cannot determine whether entity {} is enabled: {}", entityId, e.getMessage());
            return false;
        }
    }

    private void logSlots(String entityId, ScheduleMode mode, ZoneId windowZone, List<TimeSlot> slots) {
        String utc = slots.stream().map(TimeSlot::label).collect(Collectors.joining(", "));
        String local = slots.stream().map(slot -> slot.labelIn(windowZone)).collect(Collectors.joining(", "));
        log.info("Entity {} slots ({} mode): UTC [{}], {} [{}]", entityId, mode, utc, windowZone, local);
    }

    /** Arms every task or, if one cannot be armed, none of them. */
    private void armAll(String entityId, List<ScheduledTask> tasks, Instant now) {
        try {
            tasks.forEach(task -> task.arm(schedulerPort, now));
        } catch (RuntimeException e) {
            tasks.forEach(this::disarmQuietly);
            throw new ConfigurationException(
                    "Timers for entity " + entityId + " could not be registered: " + e.getMessage(), e);
        }
    }

    private void disarmQuietly(ScheduledTask task) {
        try {
            task.disarm(schedulerPort);
        } catch (Exception e) {
            log.warn("Failed to cancel task {}: {}", task.getKey(), e.getMessage());
        }
    }

    private List<String> sortedEntityIds() {
        return schedules.keySet().stream().sorted().collect(Collectors.toList());
    }

    private record EntitySchedule(ScheduleEntity entity, List<ScheduledTask> tasks) {}
}
