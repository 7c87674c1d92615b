package com.feedwatch.monitor;

/**
 * Opaque monitor logic invoked by the scheduler for one entity and one credential.
 *
 * <p>Implementations signal an exhausted upstream quota by throwing
 * {@link com.feedwatch.exception.RateLimitException}; any other exception is treated
 * as a transient failure and retried.
 */
@FunctionalInterface
public interface MonitorCallback {

    void monitor(String entityId, int credentialIndex) throws Exception;
}
