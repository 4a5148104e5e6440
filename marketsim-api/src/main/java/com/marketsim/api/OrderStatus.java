package com.marketsim.api;

/**
 * Order lifecycle.
 *
 * <pre>
 * PENDING          -> OPEN | REJECTED
 * OPEN             -> PARTIALLY_FILLED | FILLED | CANCELLED
 * PARTIALLY_FILLED -> PARTIALLY_FILLED | FILLED | CANCELLED
 * FILLED, CANCELLED, REJECTED are terminal
 * </pre>
 */
public enum OrderStatus {
    PENDING,
    OPEN,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }

    public boolean canTransitionTo(OrderStatus next) {
        switch (this) {
            case PENDING:
                return next == OPEN || next == REJECTED;
            case OPEN:
            case PARTIALLY_FILLED:
                return next == PARTIALLY_FILLED || next == FILLED || next == CANCELLED;
            default:
                return false;
        }
    }
}
