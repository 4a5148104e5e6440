package com.marketsim.api;

/**
 * Raised when an order is malformed: non-positive quantity, a missing or
 * invalid price for a priced order type, or an unknown symbol. Never retried.
 */
public class OrderValidationException extends IllegalArgumentException {

    public OrderValidationException(String message) {
        super(message);
    }
}
