package com.feedwatch.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/** A monitored subject (e.g. one tracked account) and the credentials it polls with, in rotation order. */
@Getter
@Builder
@ToString
public class MonitoredEntity {

    private final String id;

    private final boolean enabled;

    @Singular
    private final List<Credential> credentials;

    public int getCredentialCount() {
        return credentials.size();
    }
}
