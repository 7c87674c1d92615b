package com.feedwatch.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Monitored entities and their credentials, bound from {@code feedwatch.entities[*]}.
 *
 * <pre>
 * feedwatch.entities[0].id=acme
 * feedwatch.entities[0].credentials[0].id=acme-primary
 * feedwatch.entities[0].credentials[0].api-key=...
 * </pre>
 */
@ConfigurationProperties(prefix = "feedwatch")
@Getter
@Setter
public class EntityProperties {

    private List<Entity> entities = new ArrayList<>();

    @Getter
    @Setter
    public static class Entity {

        private String id;

        private boolean enabled = true;

        /** Rotation order; the slot allocator assigns them round-robin by index. */
        private List<CredentialEntry> credentials = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class CredentialEntry {

        private String id;

        private String apiKey;

        private String apiSecret;
    }
}
