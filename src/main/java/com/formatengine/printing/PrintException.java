package com.formatengine.printing;

/**
 * Raised when a formatting pass cannot continue because the IR is malformed
 * or a condition resolver failed.
 */
public class PrintException extends RuntimeException {
    private final String conditionName;

    public PrintException(String message) {
        this(message, null, null);
    }

    public PrintException(String message, String conditionName, Throwable cause) {
        super(message, cause);
        this.conditionName = conditionName;
    }

    /**
     * Name of the condition being resolved when the failure happened, if any.
     */
    public String getConditionName() {
        return conditionName;
    }
}
