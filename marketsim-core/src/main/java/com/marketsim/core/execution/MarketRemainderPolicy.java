package com.marketsim.core.execution;

/**
 * What happens to the part of a market order the book could not fill.
 */
public enum MarketRemainderPolicy {
    /** The order ends CANCELLED with whatever it got. */
    CANCEL,
    /** The order stays PARTIALLY_FILLED (or REJECTED if nothing filled) and never rests. */
    LEAVE_UNFILLED
}
