package com.feedwatch.domain.model;

import com.feedwatch.domain.enums.ScheduleMode;
import java.time.LocalTime;
import java.time.ZoneId;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Resolved polling settings shared by all entities.
 *
 * <p>{@code startTime}/{@code endTime} are already converted to UTC;
 * {@code windowZone} is the zone the operator configured them in and is only
 * used for display.
 */
@Getter
@Builder
@ToString
public class MonitorSettings {

    private final LocalTime startTime;

    private final LocalTime endTime;

    private final ZoneId windowZone;

    private final boolean testMode;

    private final int testIntervalMinutes;

    private final int requestsPerCredentialPerDay;

    public ScheduleMode getMode() {
        return testMode ? ScheduleMode.DEV_TEST : ScheduleMode.PRODUCTION;
    }
}
