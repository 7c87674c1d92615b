package com.feedwatch.schedule;

import com.feedwatch.domain.enums.ScheduleMode;
import com.feedwatch.domain.model.MonitorSettings;
import com.feedwatch.domain.model.TimeSlot;
import com.feedwatch.exception.InvalidParameterException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Converts a daily request budget into concrete trigger slots.
 *
 * <p>The rate budget of an entity is {@code credentialCount * requestsPerCredentialPerDay}
 * requests per day. In production mode those requests are spread across the configured
 * window (UTC, may wrap past midnight):
 * <ul>
 *   <li>the first slot sits exactly on the window start and the last exactly on the window end</li>
 *   <li>intermediate slots are linearly interpolated and floored to whole minutes</li>
 *   <li>credentials are assigned round-robin: slot {@code i} uses credential {@code i mod credentialCount}</li>
 * </ul>
 *
 * <p>Dev/test mode keeps the same slot count and credential rotation but ignores the window:
 * slots start 10 seconds after {@code now} and are {@code testIntervalMinutes} apart.
 *
 * <p>Stateless and deterministic: the same inputs (including {@code now}) always yield
 * the same slots.
 */
@Component
public class TimeSlotAllocator {

    static final int MINUTES_PER_DAY = 24 * 60;
    static final long DEV_START_OFFSET_SECONDS = 10;

    /**
     * Allocates slots for one entity using the shared monitor settings.
     *
     * @param credentialCount number of credentials the entity rotates through
     * @param settings        resolved settings (window already in UTC)
     * @param now             reference instant for dev/test compression
     * @return ordered slots, never empty
     * @throws InvalidParameterException if the budget resolves to zero slots
     */
    public List<TimeSlot> allocate(int credentialCount, MonitorSettings settings, Instant now) {
        if (settings.getMode() == ScheduleMode.DEV_TEST) {
            return allocateDevTest(
                    credentialCount,
                    settings.getRequestsPerCredentialPerDay(),
                    settings.getTestIntervalMinutes(),
                    now);
        }
        return allocateProduction(
                credentialCount,
                settings.getRequestsPerCredentialPerDay(),
                settings.getStartTime(),
                settings.getEndTime());
    }

    public List<TimeSlot> allocateProduction(
            int credentialCount, int requestsPerCredentialPerDay, LocalTime startTime, LocalTime endTime) {
        int total = totalSlots(credentialCount, requestsPerCredentialPerDay);
        if (startTime == null || endTime == null) {
            throw new InvalidParameterException("Monitoring window start and end are required");
        }

        int startMinutes = startTime.getHour() * 60 + startTime.getMinute();
        int endMinutes = endTime.getHour() * 60 + endTime.getMinute();
        if (endMinutes <= startMinutes) {
            // Window crosses midnight
            endMinutes += MINUTES_PER_DAY;
        }
        long windowMinutes = endMinutes - startMinutes;

        if (total == 1) {
            return List.of(minuteSlot(startMinutes, 0));
        }

        List<TimeSlot> slots = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            int minuteOfWindow;
            if (i == 0) {
                minuteOfWindow = startMinutes;
            } else if (i == total - 1) {
                minuteOfWindow = endMinutes;
            } else {
                // floor(start + i * window / (total - 1)) in exact integer arithmetic
                minuteOfWindow = startMinutes + (int) ((i * windowMinutes) / (total - 1));
            }
            slots.add(minuteSlot(minuteOfWindow, i % credentialCount));
        }
        return Collections.unmodifiableList(slots);
    }

    public List<TimeSlot> allocateDevTest(
            int credentialCount, int requestsPerCredentialPerDay, int testIntervalMinutes, Instant now) {
        int total = totalSlots(credentialCount, requestsPerCredentialPerDay);
        if (testIntervalMinutes < 1) {
            throw new InvalidParameterException(
                    "Test interval must be at least 1 minute", Map.of("testIntervalMinutes", testIntervalMinutes));
        }
        if (now == null) {
            throw new InvalidParameterException("Reference time is required in dev/test mode");
        }

        ZonedDateTime base = now.atZone(ZoneOffset.UTC).plusSeconds(DEV_START_OFFSET_SECONDS);
        List<TimeSlot> slots = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            ZonedDateTime fireAt = base.plusMinutes((long) i * testIntervalMinutes);
            slots.add(TimeSlot.builder()
                    .hour(fireAt.getHour())
                    .minute(fireAt.getMinute())
                    .second(fireAt.getSecond())
                    .credentialIndex(i % credentialCount)
                    .development(true)
                    .intervalMinutes(testIntervalMinutes)
                    .build());
        }
        return Collections.unmodifiableList(slots);
    }

    /**
     * Rate budget of one entity. Zero or negative inputs are configuration mistakes
     * that must be surfaced rather than silently producing an empty schedule.
     */
    public int totalSlots(int credentialCount, int requestsPerCredentialPerDay) {
        if (credentialCount < 1) {
            throw new InvalidParameterException(
                    "At least one credential is required", Map.of("credentialCount", credentialCount));
        }
        if (requestsPerCredentialPerDay < 1) {
            throw new InvalidParameterException(
                    "Requests per credential per day must be at least 1",
                    Map.of("requestsPerCredentialPerDay", requestsPerCredentialPerDay));
        }
        long total = (long) credentialCount * requestsPerCredentialPerDay;
        if (total > Integer.MAX_VALUE) {
            throw new InvalidParameterException("Daily request budget is too large", Map.of("total", total));
        }
        return (int) total;
    }

    private TimeSlot minuteSlot(int minuteOfWindow, int credentialIndex) {
        int hour = minuteOfWindow / 60;
        int minute = minuteOfWindow % 60;
        if (hour >= 24) {
            hour -= 24;
        }
        return TimeSlot.builder()
                .hour(hour)
                .minute(minute)
                .credentialIndex(credentialIndex)
                .build();
    }
}
