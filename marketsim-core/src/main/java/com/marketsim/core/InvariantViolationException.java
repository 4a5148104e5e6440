package com.marketsim.core;

/**
 * An internal consistency check failed. This is a defect, not a business
 * condition: the symbol lane that raised it stops processing.
 */
public class InvariantViolationException extends RuntimeException {

    private final String state;

    public InvariantViolationException(String message) {
        this(message, "");
    }

    public InvariantViolationException(String message, String state) {
        super(message);
        this.state = state;
    }

    /**
     * Dump of the structure that failed the check, for the halt log.
     */
    public String getState() {
        return state;
    }
}
