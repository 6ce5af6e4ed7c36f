package com.edgegate.backend.exception;

import lombok.Getter;

/**
 * Raised when a statistic is requested for fewer observations than its configured minimum.
 * Callers recover by substituting a conservative default.
 */
@Getter
public class InsufficientDataException extends EdgeGateException {

    private final int available;
    private final int required;

    public InsufficientDataException(String message, int available, int required) {
        super(message + " (" + available + " < " + required + ")");
        this.available = available;
        this.required = required;
    }
}
