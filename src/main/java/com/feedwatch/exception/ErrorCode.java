package com.feedwatch.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes shared by task failures and REST error bodies. {@code retryable} tells
 * whether repeating the same call may succeed without an operator fixing anything.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    INVALID_PARAMETER("INVALID_PARAMETER", 400, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", 422, false),
    RATE_LIMITED("RATE_LIMITED", 429, true),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    TRANSIENT_ERROR("TRANSIENT_ERROR", 503, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
