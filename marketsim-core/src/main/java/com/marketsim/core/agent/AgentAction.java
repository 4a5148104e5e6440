package com.marketsim.core.agent;

import com.marketsim.api.OrderRequest;

/**
 * Something an agent wants done: submit a new order, or cancel one of its own.
 */
public final class AgentAction {

    public enum Kind {
        SUBMIT,
        CANCEL
    }

    private final Kind kind;
    private final OrderRequest request;
    private final long orderId;

    private AgentAction(Kind kind, OrderRequest request, long orderId) {
        this.kind = kind;
        this.request = request;
        this.orderId = orderId;
    }

    public static AgentAction submit(OrderRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        return new AgentAction(Kind.SUBMIT, request, 0L);
    }

    public static AgentAction cancel(long orderId) {
        return new AgentAction(Kind.CANCEL, null, orderId);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Null for CANCEL.
     */
    public OrderRequest request() {
        return request;
    }

    public long orderId() {
        return orderId;
    }

    @Override
    public String toString() {
        return kind == Kind.SUBMIT ? "Submit(" + request + ")" : "Cancel(" + orderId + ")";
    }
}
