package com.marketsim.core.agent;

import com.marketsim.api.Fill;
import com.marketsim.api.OrderRequest;

import java.util.List;

/**
 * A simulated market participant.
 * <p>
 * Agents never touch the book. Once per tick they get an {@link AgentContext}
 * and return the actions they want; the engine applies them through the
 * execution engine and reports back with {@link #onSubmitted} and
 * {@link #onFill}.
 * </p>
 * The set of implementations is closed and enumerated by {@link AgentType}.
 */
public interface TradingAgent {

    /**
     * Unique within a symbol; agents act in ascending id order.
     */
    int id();

    AgentType type();

    /**
     * Owner id stamped on this agent's orders and fills.
     */
    String ownerId();

    /**
     * Net inventory in lots, long positive.
     */
    long position();

    double cash();

    /**
     * @throws AgentDecisionException when no decision can be made this tick
     */
    List<AgentAction> decide(AgentContext context);

    void onSubmitted(OrderRequest request, long orderId);

    void onFill(Fill fill);
}
