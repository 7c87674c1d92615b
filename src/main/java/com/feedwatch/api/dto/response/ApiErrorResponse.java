package com.feedwatch.api.dto.response;

import com.feedwatch.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;

/**
 * Error envelope of the {@code /api/schedule} endpoints.
 *
 * <p>{@code retryable} is taken from the {@link ErrorCode}: a rate-limited manual trigger
 * may be repeated later, a configuration error needs an operator first.
 */
public record ApiErrorResponse(boolean success, ErrorDetail error) {

    public static ApiErrorResponse of(
            ErrorCode errorCode, String message, Map<String, Object> details, String path, Instant timestamp) {
        ErrorDetail detail = new ErrorDetail(
                errorCode.getCode(),
                errorCode.getHttpStatus(),
                message,
                errorCode.isRetryable(),
                details != null ? details : Map.of(),
                path,
                timestamp);
        return new ApiErrorResponse(false, detail);
    }

    public record ErrorDetail(
            String code,
            int status,
            String message,
            boolean retryable,
            Map<String, Object> details,
            String path,
            Instant timestamp) {}
}
