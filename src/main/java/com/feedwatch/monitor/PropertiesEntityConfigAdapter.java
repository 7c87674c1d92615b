package com.feedwatch.monitor;

import com.feedwatch.config.EntityProperties;
import com.feedwatch.config.MonitorProperties;
import com.feedwatch.domain.model.Credential;
import com.feedwatch.domain.model.MonitorSettings;
import com.feedwatch.domain.model.MonitoredEntity;
import com.feedwatch.exception.ConfigurationException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link EntityConfigPort} backed by {@code feedwatch.*} application properties.
 *
 * <p>The polling window is configured in {@code window-zone} and converted to UTC using
 * the zone's offset on the current date, so a DST change moves the UTC slots on the next
 * schedule (re)creation.
 */
@Component
public class PropertiesEntityConfigAdapter implements EntityConfigPort {

    private static final Logger log = LoggerFactory.getLogger(PropertiesEntityConfigAdapter.class);

    private final MonitorProperties monitorProperties;
    private final EntityProperties entityProperties;
    private final Clock clock;

    public PropertiesEntityConfigAdapter(
            MonitorProperties monitorProperties, EntityProperties entityProperties, Clock clock) {
        this.monitorProperties = monitorProperties;
        this.entityProperties = entityProperties;
        this.clock = clock;
    }

    @Override
    public List<String> getMonitoredEntityIds() {
        return entityProperties.getEntities().stream()
                .map(EntityProperties.Entity::getId)
                .filter(id -> id != null && !id.isBlank())
                .distinct()
                .collect(Collectors.toList());
    }

    @Override
    public Optional<MonitoredEntity> getEntityById(String entityId) {
        return findEntity(entityId).map(this::toMonitoredEntity);
    }

    @Override
    public boolean isEntityMonitoringEnabled(String entityId) {
        return findEntity(entityId).map(EntityProperties.Entity::isEnabled).orElse(false);
    }

    @Override
    public MonitorSettings loadMonitorSettings() {
        ZoneId windowZone = parseZone(monitorProperties.getWindowZone());
        LocalTime start = parseTime("start-time", monitorProperties.getStartTime());
        LocalTime end = parseTime("end-time", monitorProperties.getEndTime());

        if (monitorProperties.getRequestsPerCredentialPerDay() < 1) {
            throw new ConfigurationException(
                    "feedwatch.monitor.requests-per-credential-per-day must be at least 1",
                    Map.of("requestsPerCredentialPerDay", monitorProperties.getRequestsPerCredentialPerDay()));
        }
        if (monitorProperties.isTestMode() && monitorProperties.getTestIntervalMinutes() < 1) {
            throw new ConfigurationException(
                    "feedwatch.monitor.test-interval-minutes must be at least 1",
                    Map.of("testIntervalMinutes", monitorProperties.getTestIntervalMinutes()));
        }

        return MonitorSettings.builder()
                .startTime(toUtc(start, windowZone))
                .endTime(toUtc(end, windowZone))
                .windowZone(windowZone)
                .testMode(monitorProperties.isTestMode())
                .testIntervalMinutes(monitorProperties.getTestIntervalMinutes())
                .requestsPerCredentialPerDay(monitorProperties.getRequestsPerCredentialPerDay())
                .build();
    }

    private Optional<EntityProperties.Entity> findEntity(String entityId) {
        if (entityId == null) {
            return Optional.empty();
        }
        return entityProperties.getEntities().stream()
                .filter(entity -> entityId.equals(entity.getId()))
                .findFirst();
    }

    private MonitoredEntity toMonitoredEntity(EntityProperties.Entity entity) {
        MonitoredEntity.MonitoredEntityBuilder builder =
                MonitoredEntity.builder().id(entity.getId()).enabled(entity.isEnabled());
        List<EntityProperties.CredentialEntry> entries = entity.getCredentials();
        for (int i = 0; i < entries.size(); i++) {
            EntityProperties.CredentialEntry entry = entries.get(i);
            if (entry.getApiKey() == null || entry.getApiKey().isBlank()) {
                log.warn("Ignoring credential #{} of entity {}: no api-key", i, entity.getId());
                continue;
            }
            String id = entry.getId() != null && !entry.getId().isBlank() ? entry.getId() : entity.getId() + "-" + i;
            builder.credential(Credential.builder()
                    .id(id)
                    .apiKey(entry.getApiKey())
                    .apiSecret(entry.getApiSecret())
                    .build());
        }
        return builder.build();
    }

    private LocalTime toUtc(LocalTime time, ZoneId zone) {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        return time.atDate(today).atZone(zone).withZoneSameInstant(ZoneOffset.UTC).toLocalTime();
    }

    private static LocalTime parseTime(String property, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("feedwatch.monitor." + property + " is required");
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(
                    "feedwatch.monitor." + property + " is not a valid HH:MM time: " + value, e);
        }
    }

    private static ZoneId parseZone(String value) {
        if (value == null || value.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            throw new ConfigurationException("feedwatch.monitor.window-zone is not a valid zone id: " + value, e);
        }
    }
}
