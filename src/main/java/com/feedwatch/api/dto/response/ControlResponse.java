package com.feedwatch.api.dto.response;

/**
 * Result of a scheduler control call.
 *
 * @param changed false when the call was a no-op (e.g. start while already running)
 *                or the requested run did not succeed
 */
public record ControlResponse(boolean changed) {

    public static ControlResponse of(boolean changed) {
        return new ControlResponse(changed);
    }
}
