package com.feedwatch.domain.enums;

/**
 * How trigger slots are laid out for a day.
 *
 * <ul>
 *   <li>{@code PRODUCTION} -- slots spread evenly across the configured window</li>
 *   <li>{@code DEV_TEST} -- the same number of slots compressed into a few minutes
 *       starting shortly after "now", so a full day's rotation can be observed quickly</li>
 * </ul>
 */
public enum ScheduleMode {
    PRODUCTION,
    DEV_TEST
}
