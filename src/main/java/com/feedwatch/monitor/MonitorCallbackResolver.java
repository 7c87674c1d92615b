package com.feedwatch.monitor;

import com.feedwatch.credential.CredentialFailoverCallback;
import com.feedwatch.credential.CredentialRotator;
import java.util.Optional;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Locates the monitor logic the deployment provides.
 *
 * <p>A {@link MonitorCallback} bean is used as is. Otherwise a {@link FeedPoller} bean is
 * wrapped in a {@link CredentialFailoverCallback}. With neither, scheduling stays disabled.
 */
@Component
public class MonitorCallbackResolver {

    private final ObjectProvider<MonitorCallback> monitorCallbacks;
    private final ObjectProvider<FeedPoller> feedPollers;
    private final EntityConfigPort entityConfigPort;
    private final CredentialRotator credentialRotator;

    public MonitorCallbackResolver(
            ObjectProvider<MonitorCallback> monitorCallbacks,
            ObjectProvider<FeedPoller> feedPollers,
            EntityConfigPort entityConfigPort,
            CredentialRotator credentialRotator) {
        this.monitorCallbacks = monitorCallbacks;
        this.feedPollers = feedPollers;
        this.entityConfigPort = entityConfigPort;
        this.credentialRotator = credentialRotator;
    }

    public Optional<MonitorCallback> resolve() {
        MonitorCallback callback = monitorCallbacks.getIfUnique();
        if (callback != null) {
            return Optional.of(callback);
        }
        FeedPoller feedPoller = feedPollers.getIfUnique();
        if (feedPoller != null) {
            return Optional.of(new CredentialFailoverCallback(feedPoller, entityConfigPort, credentialRotator));
        }
        return Optional.empty();
    }
}
