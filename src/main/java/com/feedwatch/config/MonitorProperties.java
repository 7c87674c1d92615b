package com.feedwatch.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Polling window and budget shared by every monitored entity.
 *
 * <p>Binds to the {@code feedwatch.monitor.*} prefix. Values are kept as raw strings
 * here; {@link com.feedwatch.monitor.PropertiesEntityConfigAdapter} parses and validates
 * them so that a bad value fails the scheduling of entities instead of the context startup.
 */
@ConfigurationProperties(prefix = "feedwatch.monitor")
@Getter
@Setter
public class MonitorProperties {

    /** Window start, {@code HH:MM} in {@link #windowZone}. */
    private String startTime = "09:00";

    /** Window end, {@code HH:MM} in {@link #windowZone}. Earlier than start means the window wraps midnight. */
    private String endTime = "23:00";

    /** IANA zone id the window is expressed in. */
    private String windowZone = "UTC";

    /** Compresses the day's slots into a short sequence starting right away. */
    private boolean testMode = false;

    /** Spacing between slots in test mode. */
    private int testIntervalMinutes = 1;

    /** Upstream quota of a single credential. */
    private int requestsPerCredentialPerDay = 3;
}
