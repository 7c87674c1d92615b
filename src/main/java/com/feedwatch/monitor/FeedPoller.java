package com.feedwatch.monitor;

import com.feedwatch.domain.model.Credential;
import com.feedwatch.domain.model.MonitoredEntity;

/**
 * Performs the actual upstream fetch for one entity with one credential and relays
 * whatever it discovers. Provided by the deployment; this service only schedules it.
 */
@FunctionalInterface
public interface FeedPoller {

    /**
     * @throws com.feedwatch.exception.RateLimitException when the credential's quota is exhausted
     */
    void poll(MonitoredEntity entity, Credential credential) throws Exception;
}
