package com.feedwatch.api.dto.response;

import java.time.Clock;
import java.time.Instant;

/**
 * Success envelope of the {@code /api/schedule} endpoints. The timestamp is read from the
 * application clock, the same one that stamps task statistics and next-run instants.
 */
public record ApiResponse<T>(boolean success, T data, Instant timestamp) {

    public static <T> ApiResponse<T> of(T data, Clock clock) {
        return new ApiResponse<>(true, data, clock.instant());
    }
}
