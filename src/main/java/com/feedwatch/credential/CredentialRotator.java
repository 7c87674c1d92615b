package com.feedwatch.credential;

import com.feedwatch.domain.model.Credential;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the credential that follows the current one in rotation order.
 *
 * <p>Used for monitor-level failover when a credential hits its upstream quota. Scheduled
 * slots never rotate; they always use the credential the allocator assigned them.
 */
@Component
public class CredentialRotator {

    private static final Logger log = LoggerFactory.getLogger(CredentialRotator.class);

    /**
     * Returns the credential after {@code currentId}, wrapping to the first after the last.
     * An unknown or null id yields the first credential; an empty list yields nothing.
     * With a single credential the result is that same credential.
     */
    public Optional<Credential> nextCredential(List<Credential> credentials, String currentId) {
        if (credentials == null || credentials.isEmpty()) {
            return Optional.empty();
        }
        int currentIndex = indexOf(credentials, currentId);
        if (currentIndex < 0) {
            log.debug("Credential {} not in rotation, falling back to the first one", currentId);
            return Optional.of(credentials.get(0));
        }
        return Optional.of(credentials.get((currentIndex + 1) % credentials.size()));
    }

    private int indexOf(List<Credential> credentials, String credentialId) {
        if (credentialId == null) {
            return -1;
        }
        for (int i = 0; i < credentials.size(); i++) {
            if (credentialId.equals(credentials.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }
}
