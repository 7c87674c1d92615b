package com.feedwatch.exception;

/**
 * Marker raised by a feed poller when the upstream quota of a credential is
 * exhausted (HTTP 429 or equivalent).
 */
public class RateLimitException extends TransientExecutionException {

    private final String credentialId;

    public RateLimitException(String credentialId, String message) {
        super(ErrorCode.RATE_LIMITED, message, null);
        this.credentialId = credentialId;
    }

    public RateLimitException(String credentialId, String message, Throwable cause) {
        super(ErrorCode.RATE_LIMITED, message, cause);
        this.credentialId = credentialId;
    }

    public String getCredentialId() {
        return credentialId;
    }
}
