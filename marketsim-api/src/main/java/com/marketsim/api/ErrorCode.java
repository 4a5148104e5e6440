package com.marketsim.api;

public enum ErrorCode {
    /** Malformed order or argument; never retried. */
    VALIDATION_ERROR,
    /** Unknown symbol, or an order that is unknown or already terminal. */
    NOT_FOUND,
    ALREADY_EXISTS,
    /** The symbol's lane stopped after an internal consistency failure. */
    LANE_HALTED,
    /** The simulator is not accepting work (stopped or closed). */
    UNAVAILABLE,
    INTERNAL_ERROR
}
