package com.feedwatch.monitor;

import com.feedwatch.domain.model.MonitorSettings;
import com.feedwatch.domain.model.MonitoredEntity;
import java.util.List;
import java.util.Optional;

/** Source of monitored entities and shared polling settings. */
public interface EntityConfigPort {

    List<String> getMonitoredEntityIds();

    Optional<MonitoredEntity> getEntityById(String entityId);

    boolean isEntityMonitoringEnabled(String entityId);

    /**
     * @throws com.feedwatch.exception.ConfigurationException if the settings cannot be resolved
     */
    MonitorSettings loadMonitorSettings();
}
