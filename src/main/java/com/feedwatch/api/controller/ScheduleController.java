package com.feedwatch.api.controller;

import com.feedwatch.api.dto.response.CleanupResponse;
import com.feedwatch.api.dto.response.ControlResponse;
import com.feedwatch.domain.model.TaskStats;
import com.feedwatch.exception.ConfigurationException;
import com.feedwatch.exception.InvalidParameterException;
import com.feedwatch.monitor.MonitorCallback;
import com.feedwatch.monitor.MonitorCallbackResolver;
import com.feedwatch.schedule.NextExecution;
import com.feedwatch.schedule.ScheduleManager;
import com.feedwatch.schedule.ScheduleStatus;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST control surface of the monitor scheduler.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/schedule/status -- running flag, entities, slots and active task count</li>
 *   <li>GET /api/schedule/stats -- per-task execution statistics, optionally for one entity</li>
 *   <li>GET /api/schedule/next -- upcoming fire times per entity</li>
 *   <li>POST /api/schedule/start, /stop -- arm or disarm every timer</li>
 *   <li>POST /api/schedule/reload -- recompute every entity from configuration</li>
 *   <li>POST /api/schedule/trigger/{entityId} -- run one entity now with a given credential</li>
 *   <li>POST /api/schedule/stats/cleanup -- drop statistics older than N days</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/schedule")
public class ScheduleController {

    private static final Logger log = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleManager scheduleManager;
    private final MonitorCallbackResolver monitorCallbackResolver;

    public ScheduleController(ScheduleManager scheduleManager, MonitorCallbackResolver monitorCallbackResolver) {
        this.scheduleManager = scheduleManager;
        this.monitorCallbackResolver = monitorCallbackResolver;
    }

    @GetMapping("/status")
    public ResponseEntity<ScheduleStatus> getStatus() {
        return ResponseEntity.ok(scheduleManager.getStatus());
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, TaskStats>> getStats(@RequestParam(required = false) String entityId) {
        return ResponseEntity.ok(scheduleManager.getTaskStats(entityId));
    }

    @GetMapping("/next")
    public ResponseEntity<Map<String, List<NextExecution>>> getNextExecutions(
            @RequestParam(required = false) String entityId) {
        return ResponseEntity.ok(scheduleManager.getNextExecutions(entityId));
    }

    @PostMapping("/start")
    public ResponseEntity<ControlResponse> start() {
        log.info("Schedule start requested via API");
        return ResponseEntity.ok(ControlResponse.of(scheduleManager.start()));
    }

    @PostMapping("/stop")
    public ResponseEntity<ControlResponse> stop() {
        log.info("Schedule stop requested via API");
        return ResponseEntity.ok(ControlResponse.of(scheduleManager.stop()));
    }

    @PostMapping("/reload")
    public ResponseEntity<ControlResponse> reload() {
        log.info("Schedule reload requested via API");
        return ResponseEntity.ok(ControlResponse.of(scheduleManager.reload(requireCallback())));
    }

    /**
     * Runs the entity's monitor once through the retry path. Blocks until the run settles,
     * which with the default policy can take more than a minute.
     */
    @PostMapping("/trigger/{entityId}")
    public ResponseEntity<ControlResponse> trigger(
            @PathVariable String entityId, @RequestParam(defaultValue = "0") int credentialIndex) {
        if (credentialIndex < 0) {
            throw new InvalidParameterException(
                    "credentialIndex must not be negative", Map.of("credentialIndex", credentialIndex));
        }
        boolean succeeded = scheduleManager.manualTrigger(entityId, credentialIndex, requireCallback());
        return ResponseEntity.ok(ControlResponse.of(succeeded));
    }

    @PostMapping("/stats/cleanup")
    public ResponseEntity<CleanupResponse> cleanupStats(@RequestParam(defaultValue = "7") int daysToKeep) {
        if (daysToKeep < 0) {
            throw new InvalidParameterException("daysToKeep must not be negative", Map.of("daysToKeep", daysToKeep));
        }
        int removed = scheduleManager.cleanupTaskStats(daysToKeep);
        return ResponseEntity.ok(new CleanupResponse(removed, daysToKeep));
    }

    private MonitorCallback requireCallback() {
        return monitorCallbackResolver
                .resolve()
                .orElseThrow(() -> new ConfigurationException("No monitor callback is configured"));
    }
}
