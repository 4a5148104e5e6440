package com.marketsim.core.agent;

import com.marketsim.api.OrderRequest;
import com.marketsim.api.Side;
import com.marketsim.core.SimulationConfig;

import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Follows the trend: when the last reference price move is at least
 * {@code threshold}, sends a marketable limit in the same direction, priced
 * {@code offset} through the best opposite quote.
 */
public class MomentumTrader extends AbstractTradingAgent {

    private final double probability;
    private final long size;
    private final double threshold;
    private final double offset;

    public MomentumTrader(int id, String symbol, SimulationConfig config, Random random) {
        super(id, symbol, random);
        this.probability = config.momentumProbability();
        this.size = config.momentumSize();
        this.threshold = config.momentumThreshold();
        this.offset = config.momentumOffset();
    }

    @Override
    public AgentType type() {
        return AgentType.MOMENTUM;
    }

    @Override
    public List<AgentAction> decide(AgentContext context) {
        if (random.nextDouble() >= probability) {
            return Collections.emptyList();
        }
        double momentum = context.state().momentum();
        if (Math.abs(momentum) < threshold) {
            return Collections.emptyList();
        }
        Side side = momentum > 0 ? Side.BUY : Side.SELL;
        double touch = side == Side.BUY ? context.book().bestAsk() : context.book().bestBid();
        if (Double.isNaN(touch)) {
            touch = context.referencePrice();
        }
        double price = side == Side.BUY
                ? roundToTick(touch * (1.0 + offset), context.tickSize(), true)
                : roundToTick(touch * (1.0 - offset), context.tickSize(), false);
        return List.of(AgentAction.submit(OrderRequest.limit(symbol, side, size, price, ownerId())));
    }
}
