package com.feedwatch.unit.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.feedwatch.config.EntityProperties;
import com.feedwatch.config.MonitorProperties;
import com.feedwatch.domain.enums.ScheduleMode;
import com.feedwatch.domain.model.Credential;
import com.feedwatch.domain.model.MonitorSettings;
import com.feedwatch.domain.model.MonitoredEntity;
import com.feedwatch.exception.ConfigurationException;
import com.feedwatch.monitor.PropertiesEntityConfigAdapter;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PropertiesEntityConfigAdapterTest {

    private MonitorProperties monitorProperties;
    private EntityProperties entityProperties;
    private PropertiesEntityConfigAdapter adapter;

    @BeforeEach
    void setUp() {
        monitorProperties = new MonitorProperties();
        entityProperties = new EntityProperties();
        entityProperties.getEntities().add(entity("acme", true, "acme-primary", "acme-secondary"));
        entityProperties.getEntities().add(entity("initech", false, "initech-primary"));
        adapter = new PropertiesEntityConfigAdapter(
                monitorProperties,
                entityProperties,
                Clock.fixed(Instant.parse("2025-03-10T00:00:00Z"), ZoneOffset.UTC));
    }

    private static EntityProperties.Entity entity(String id, boolean enabled, String... credentialIds) {
        EntityProperties.Entity entity = new EntityProperties.Entity();
        entity.setId(id);
        entity.setEnabled(enabled);
        for (String credentialId : credentialIds) {
            EntityProperties.CredentialEntry entry = new EntityProperties.CredentialEntry();
            entry.setId(credentialId);
            entry.setApiKey("key-" + credentialId);
            entry.setApiSecret("secret-" + credentialId);
            entity.getCredentials().add(entry);
        }
        return entity;
    }

    @Nested
    @DisplayName("Entities")
    class Entities {

        @Test
        @DisplayName("Lists every configured entity, enabled or not")
        void listsEntities() {
            assertThat(adapter.getMonitoredEntityIds()).containsExactly("acme", "initech");
            assertThat(adapter.isEntityMonitoringEnabled("acme")).isTrue();
            assertThat(adapter.isEntityMonitoringEnabled("initech")).isFalse();
            assertThat(adapter.isEntityMonitoringEnabled("missing")).isFalse();
        }

        @Test
        @DisplayName("Maps credentials in configuration order")
        void mapsCredentials() {
            MonitoredEntity acme = adapter.getEntityById("acme").orElseThrow();

            assertThat(acme.getCredentialCount()).isEqualTo(2);
            assertThat(acme.getCredentials())
                    .extracting(Credential::getId)
                    .containsExactly("acme-primary", "acme-secondary");
            assertThat(acme.getCredentials().get(0).getApiKey()).isEqualTo("key-acme-primary");
        }

        @Test
        @DisplayName("Skips credentials without a key and names anonymous ones by position")
        void credentialDefaults() {
            EntityProperties.Entity globex = entity("globex", true, "unused");
            globex.getCredentials().get(0).setApiKey(null);
            EntityProperties.CredentialEntry anonymous = new EntityProperties.CredentialEntry();
            anonymous.setApiKey("key-anonymous");
            globex.getCredentials().add(anonymous);
            entityProperties.getEntities().add(globex);

            List<Credential> credentials = adapter.getEntityById("globex").orElseThrow().getCredentials();

            assertThat(credentials).extracting(Credential::getId).containsExactly("globex-1");
        }

        @Test
        @DisplayName("Unknown entity is empty")
        void unknownEntity() {
            assertThat(adapter.getEntityById("missing")).isEmpty();
            assertThat(adapter.getEntityById(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Monitor settings")
    class Settings {

        @Test
        @DisplayName("Defaults describe a 09:00-23:00 UTC production window")
        void defaults() {
            MonitorSettings settings = adapter.loadMonitorSettings();

            assertThat(settings.getStartTime()).isEqualTo(LocalTime.of(9, 0));
            assertThat(settings.getEndTime()).isEqualTo(LocalTime.of(23, 0));
            assertThat(settings.getRequestsPerCredentialPerDay()).isEqualTo(3);
            assertThat(settings.getMode()).isEqualTo(ScheduleMode.PRODUCTION);
        }

        @Test
        @DisplayName("Converts a UTC+8 window to UTC")
        void convertsWindowZone() {
            monitorProperties.setWindowZone("Asia/Shanghai");

            MonitorSettings settings = adapter.loadMonitorSettings();

            assertThat(settings.getStartTime()).isEqualTo(LocalTime.of(1, 0));
            assertThat(settings.getEndTime()).isEqualTo(LocalTime.of(15, 0));
            assertThat(settings.getWindowZone()).isEqualTo(ZoneId.of("Asia/Shanghai"));
        }

        @Test
        @DisplayName("Test mode is reported as DEV_TEST")
        void testMode() {
            monitorProperties.setTestMode(true);
            monitorProperties.setTestIntervalMinutes(2);

            MonitorSettings settings = adapter.loadMonitorSettings();

            assertThat(settings.getMode()).isEqualTo(ScheduleMode.DEV_TEST);
            assertThat(settings.getTestIntervalMinutes()).isEqualTo(2);
        }

        @Test
        @DisplayName("Invalid values are configuration errors")
        void invalidValues() {
            monitorProperties.setStartTime("9 o'clock");
            assertThatThrownBy(() -> adapter.loadMonitorSettings()).isInstanceOf(ConfigurationException.class);

            monitorProperties.setStartTime("09:00");
            monitorProperties.setWindowZone("Mars/Olympus");
            assertThatThrownBy(() -> adapter.loadMonitorSettings()).isInstanceOf(ConfigurationException.class);

            monitorProperties.setWindowZone("UTC");
            monitorProperties.setRequestsPerCredentialPerDay(0);
            assertThatThrownBy(() -> adapter.loadMonitorSettings()).isInstanceOf(ConfigurationException.class);
        }
    }
}
