package com.feedwatch.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.feedwatch.api.controller.ScheduleController;
import com.feedwatch.config.ApiResponseAdvice;
import com.feedwatch.domain.model.TaskKey;
import com.feedwatch.domain.model.TaskStats;
import com.feedwatch.exception.GlobalExceptionHandler;
import com.feedwatch.monitor.MonitorCallback;
import com.feedwatch.monitor.MonitorCallbackResolver;
import com.feedwatch.schedule.NextExecution;
import com.feedwatch.schedule.ScheduleManager;
import com.feedwatch.schedule.ScheduleStatus;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for ScheduleController with the response envelope and error mapping applied
 * the same way as in the running application.
 */
class ScheduleControllerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-10T10:00:00Z"), ZoneOffset.UTC);

    private MockMvc mockMvc;

    @Mock
    private ScheduleManager scheduleManager;

    @Mock
    private MonitorCallbackResolver monitorCallbackResolver;

    private final MonitorCallback callback = (entityId, credentialIndex) -> {};

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        ScheduleController controller = new ScheduleController(scheduleManager, monitorCallbackResolver);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(clock), new ApiResponseAdvice(clock))
                .build();
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("GET /status returns the wrapped scheduler status")
        void getStatus() throws Exception {
            ScheduleStatus status = ScheduleStatus.builder()
                    .running(true)
                    .totalEntities(1)
                    .activeTasks(6)
                    .entities(Map.of(
                            "acme",
                            ScheduleStatus.EntityStatus.builder()
                                    .credentialCount(2)
                                    .slotCount(6)
                                    .slots(List.of("09:00", "11:48", "14:36", "17:24", "20:12", "23:00"))
                                    .credentialIndexes(List.of(0, 1, 0, 1, 0, 1))
                                    .active(true)
                                    .build()))
                    .build();
            when(scheduleManager.getStatus()).thenReturn(status);

            mockMvc.perform(get("/api/schedule/status"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.running").value(true))
                    .andExpect(jsonPath("$.data.activeTasks").value(6))
                    .andExpect(jsonPath("$.data.entities.acme.slotCount").value(6))
                    .andExpect(jsonPath("$.data.entities.acme.slots[1]").value("11:48"))
                    .andExpect(jsonPath("$.data.entities.acme.credentialIndexes[1]").value(1));
        }

        @Test
        @DisplayName("GET /stats filters by entity and reports the success rate")
        void stats() throws Exception {
            TaskKey key = new TaskKey("acme", 0, "09:00");
            TaskStats stats = TaskStats.empty(key, Instant.parse("2025-03-10T09:00:00Z"))
                    .started(Instant.parse("2025-03-10T09:00:00Z"))
                    .succeeded(Instant.parse("2025-03-10T09:00:01Z"));
            when(scheduleManager.getTaskStats("acme")).thenReturn(Map.of(key.toString(), stats));

            mockMvc.perform(get("/api/schedule/stats").param("entityId", "acme"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data['acme-0-09:00'].totalRuns").value(1))
                    .andExpect(jsonPath("$.data['acme-0-09:00'].successCount").value(1))
                    .andExpect(jsonPath("$.data['acme-0-09:00'].successRate").value("100.00"));
        }

        @Test
        @DisplayName("GET /stats without a filter returns every task")
        void statsUnfiltered() throws Exception {
            when(scheduleManager.getTaskStats(isNull())).thenReturn(Map.of());

            mockMvc.perform(get("/api/schedule/stats")).andExpect(status().isOk());

            verify(scheduleManager).getTaskStats(null);
        }

        @Test
        @DisplayName("GET /next lists upcoming executions per entity")
        void next() throws Exception {
            when(scheduleManager.getNextExecutions("acme"))
                    .thenReturn(Map.of(
                            "acme", List.of(new NextExecution(Instant.parse("2025-03-10T11:48:00Z"), "11:48", 1))));

            mockMvc.perform(get("/api/schedule/next").param("entityId", "acme"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.acme[0].slot").value("11:48"))
                    .andExpect(jsonPath("$.data.acme[0].credentialIndex").value(1));
        }
    }

    @Nested
    @DisplayName("Control")
    class Control {

        @Test
        @DisplayName("POST /start reports whether the state changed")
        void start() throws Exception {
            when(scheduleManager.start()).thenReturn(false);

            mockMvc.perform(post("/api/schedule/start"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.changed").value(false));
        }

        @Test
        @DisplayName("POST /stop reports whether the state changed")
        void stop() throws Exception {
            when(scheduleManager.stop()).thenReturn(true);

            mockMvc.perform(post("/api/schedule/stop"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.changed").value(true));
        }

        @Test
        @DisplayName("POST /reload uses the resolved monitor callback")
        void reload() throws Exception {
            when(monitorCallbackResolver.resolve()).thenReturn(Optional.of(callback));
            when(scheduleManager.reload(callback)).thenReturn(true);

            mockMvc.perform(post("/api/schedule/reload"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.changed").value(true));
        }

        @Test
        @DisplayName("POST /reload without a monitor callback is a configuration error")
        void reloadWithoutCallback() throws Exception {
            when(monitorCallbackResolver.resolve()).thenReturn(Optional.empty());

            mockMvc.perform(post("/api/schedule/reload"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("CONFIGURATION_ERROR"))
                    .andExpect(jsonPath("$.error.status").value(422))
                    .andExpect(jsonPath("$.error.retryable").value(false))
                    .andExpect(jsonPath("$.error.path").value("/api/schedule/reload"));

            verify(scheduleManager, never()).reload(any());
        }

        @Test
        @DisplayName("POST /trigger runs the entity with the requested credential")
        void trigger() throws Exception {
            when(monitorCallbackResolver.resolve()).thenReturn(Optional.of(callback));
            when(scheduleManager.manualTrigger("acme", 1, callback)).thenReturn(true);

            mockMvc.perform(post("/api/schedule/trigger/acme").param("credentialIndex", "1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.changed").value(true));
        }

        @Test
        @DisplayName("POST /trigger rejects a negative credential index")
        void triggerNegativeIndex() throws Exception {
            mockMvc.perform(post("/api/schedule/trigger/acme").param("credentialIndex", "-1"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("INVALID_PARAMETER"));

            verify(scheduleManager, never()).manualTrigger(any(), anyInt(), any());
        }

        @Test
        @DisplayName("POST /trigger rejects a non-numeric credential index")
        void triggerNonNumericIndex() throws Exception {
            mockMvc.perform(post("/api/schedule/trigger/acme").param("credentialIndex", "first"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
        }

        @Test
        @DisplayName("POST /stats/cleanup returns the number of removed entries")
        void cleanup() throws Exception {
            when(scheduleManager.cleanupTaskStats(eq(3))).thenReturn(4);

            mockMvc.perform(post("/api/schedule/stats/cleanup").param("daysToKeep", "3"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.removed").value(4))
                    .andExpect(jsonPath("$.data.daysToKeep").value(3));
        }
    }
}
