package com.marketsim.core.execution;

import com.marketsim.api.Fill;
import com.marketsim.api.OrderReport;

/**
 * Order lifecycle events out of the {@link ExecutionEngine}, delivered on the
 * engine's thread in the order they happen.
 */
public interface ExecutionListener {

    void onFill(Fill fill);

    /**
     * The order is live: resting in the book, or held as an untriggered stop.
     */
    default void onOrderAccepted(OrderReport order) {
    }

    default void onOrderRejected(OrderReport order, String reason) {
    }

    /**
     * Cancelled on request, or a market remainder cancelled by policy.
     */
    default void onOrderCancelled(OrderReport order) {
    }

    ExecutionListener NO_OP = fill -> {
    };
}
