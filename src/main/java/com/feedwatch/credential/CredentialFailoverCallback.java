package com.feedwatch.credential;

import com.feedwatch.domain.model.Credential;
import com.feedwatch.domain.model.MonitoredEntity;
import com.feedwatch.exception.ConfigurationException;
import com.feedwatch.exception.RateLimitException;
import com.feedwatch.monitor.EntityConfigPort;
import com.feedwatch.monitor.FeedPoller;
import com.feedwatch.monitor.MonitorCallback;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts a {@link FeedPoller} into a {@link MonitorCallback} with one-step credential failover.
 *
 * <p>The slot's credential is polled first. If it is rate limited, the next credential in
 * rotation is polled once in the same attempt. A rate limit on the replacement (or a single
 * credential with nowhere to rotate) propagates, leaving the backoff to
 * {@link com.feedwatch.schedule.RetryExecutor}.
 */
public class CredentialFailoverCallback implements MonitorCallback {

    private static final Logger log = LoggerFactory.getLogger(CredentialFailoverCallback.class);

    private final FeedPoller feedPoller;
    private final EntityConfigPort entityConfigPort;
    private final CredentialRotator credentialRotator;

    public CredentialFailoverCallback(
            FeedPoller feedPoller, EntityConfigPort entityConfigPort, CredentialRotator credentialRotator) {
        this.feedPoller = feedPoller;
        this.entityConfigPort = entityConfigPort;
        this.credentialRotator = credentialRotator;
    }

    @Override
    public void monitor(String entityId, int credentialIndex) throws Exception {
        MonitoredEntity entity = entityConfigPort
                .getEntityById(entityId)
                .orElseThrow(() -> new ConfigurationException("Unknown monitored entity: " + entityId));
        List<Credential> credentials = entity.getCredentials();
        if (credentialIndex < 0 || credentialIndex >= credentials.size()) {
            throw new ConfigurationException(
                    "Credential index out of range for entity " + entityId,
                    Map.of("credentialIndex", credentialIndex, "credentialCount", credentials.size()));
        }

        Credential credential = credentials.get(credentialIndex);
        try {
            feedPoller.poll(entity, credential);
        } catch (RateLimitException e) {
            Optional<Credential> next = credentialRotator.nextCredential(credentials, credential.getId());
            if (next.isEmpty() || next.get().equals(credential)) {
                throw e;
            }
            log.warn(
                    "Credential {} ({}) rate limited for entity {}, switching to {} ({})",
                    credential.getId(),
                    credential.maskedKey(),
                    entityId,
                    next.get().getId(),
                    next.get().maskedKey());
            feedPoller.poll(entity, next.get());
        }
    }
}
