package com.feedwatch.exception;

import java.util.Map;

/**
 * Missing or invalid monitoring setup for an entity (unknown id, no credentials,
 * unparseable window). Aborts scheduling for that entity only.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIGURATION_ERROR, message, details);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, cause);
    }
}
