package com.feedwatch.exception;

import java.util.Map;

/**
 * Rejected input at the allocator or manager boundary, e.g. zero credentials
 * or a zero total slot count.
 */
public class InvalidParameterException extends BaseException {

    public InvalidParameterException(String message) {
        super(ErrorCode.INVALID_PARAMETER, message);
    }

    public InvalidParameterException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_PARAMETER, message, details);
    }
}
