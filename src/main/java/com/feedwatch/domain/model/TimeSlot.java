package com.feedwatch.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One daily trigger point bound to one credential. Always expressed in UTC.
 *
 * <p>Production slots have minute precision ({@code second == null}). Dev/test slots
 * carry seconds and are flagged {@code development} with the compression interval
 * that produced them.
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString
public class TimeSlot {

    private final int hour;

    private final int minute;

    /** Null for minute-precision slots. */
    private final Integer second;

    private final int credentialIndex;

    private final boolean development;

    /** Spacing between consecutive dev/test slots; null in production. */
    private final Integer intervalMinutes;

    public boolean hasSeconds() {
        return second != null;
    }

    public LocalTime toLocalTime() {
        return LocalTime.of(hour, minute, second != null ? second : 0);
    }

    /** Minutes since UTC midnight, ignoring seconds. */
    public int minuteOfDay() {
        return hour * 60 + minute;
    }

    /** {@code HH:MM} or {@code HH:MM:SS} when the slot has second precision. */
    public String label() {
        if (second != null) {
            return String.format("%02d:%02d:%02d", hour, minute, second);
        }
        return String.format("%02d:%02d", hour, minute);
    }

    /** The slot's wall-clock time rendered in another zone, for operator-facing logs. */
    public String labelIn(ZoneId zone) {
        LocalTime local = ZonedDateTime.of(LocalDate.now(ZoneOffset.UTC), toLocalTime(), ZoneOffset.UTC)
                .withZoneSameInstant(zone)
                .toLocalTime();
        if (second != null) {
            return String.format("%02d:%02d:%02d", local.getHour(), local.getMinute(), local.getSecond());
        }
        return String.format("%02d:%02d", local.getHour(), local.getMinute());
    }

    /** Six-field Spring cron expression firing once a day at this slot (evaluated in UTC). */
    public String toCronExpression() {
        return String.format("%d %d %d * * *", second != null ? second : 0, minute, hour);
    }

    /**
     * The first instant strictly after {@code now} at which this slot fires.
     * Today's occurrence if it is still ahead, otherwise tomorrow's.
     */
    public Instant nextFireAfter(Instant now) {
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        Instant candidate = today.atTime(toLocalTime()).toInstant(ZoneOffset.UTC);
        if (!candidate.isAfter(now)) {
            candidate = today.plusDays(1).atTime(toLocalTime()).toInstant(ZoneOffset.UTC);
        }
        return candidate;
    }
}
