package com.marketsim.core.agent;

import com.marketsim.api.OrderRequest;
import com.marketsim.api.Side;
import com.marketsim.core.SimulationConfig;

import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Trades on a private, noisy preview of the next price move.
 * <p>
 * {@code signal = nextMove + N(0, signalNoise * price)}. When
 * {@code |signal| / price} clears the threshold it sends a market order in the
 * signal's direction.
 * </p>
 */
public class InformedTrader extends AbstractTradingAgent {

    private final double probability;
    private final long size;
    private final double threshold;
    private final double signalNoise;

    public InformedTrader(int id, String symbol, SimulationConfig config, Random random) {
        super(id, symbol, random);
        this.probability = config.informedProbability();
        this.size = config.informedSize();
        this.threshold = config.informedThreshold();
        this.signalNoise = config.informedSignalNoise();
    }

    @Override
    public AgentType type() {
        return AgentType.INFORMED;
    }

    @Override
    public List<AgentAction> decide(AgentContext context) {
        if (random.nextDouble() >= probability) {
            return Collections.emptyList();
        }
        double price = context.referencePrice();
        double signal = context.nextMove() + random.nextGaussian() * signalNoise * price;
        if (Math.abs(signal) / price < threshold) {
            return Collections.emptyList();
        }
        Side side = signal > 0 ? Side.BUY : Side.SELL;
        return List.of(AgentAction.submit(OrderRequest.market(symbol, side, size, ownerId())));
    }
}
