package com.feedwatch.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** The slot plan computed for one entity when its schedule was (re)created. */
@Getter
@Builder
public class ScheduleEntity {

    private final String entityId;

    private final int credentialCount;

    private final List<TimeSlot> slots;

    private final Instant createdAt;
}
