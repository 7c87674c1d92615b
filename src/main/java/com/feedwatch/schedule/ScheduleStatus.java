package com.feedwatch.schedule;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Point-in-time view of the scheduler returned by {@link ScheduleManager#getStatus()}. */
@Getter
@Builder
public class ScheduleStatus {

    private final boolean running;

    private final int totalEntities;

    private final int activeTasks;

    private final Map<String, EntityStatus> entities;

    @Getter
    @Builder
    public static class EntityStatus {

        private final int credentialCount;

        private final int slotCount;

        /** Slot labels in generation order, UTC. */
        private final List<String> slots;

        /** Credential index of each slot, same order as {@link #slots}. */
        private final List<Integer> credentialIndexes;

        private final boolean active;

        private final Instant createdAt;

        private final Instant nextRun;
    }
}
