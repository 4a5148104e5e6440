package com.marketsim.core.agent;

import com.marketsim.api.OrderRequest;
import com.marketsim.api.Side;
import com.marketsim.core.SimulationConfig;

import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Trades at random with no edge: random tick, side and size; a market order
 * most of the time, otherwise a limit within {@code limitOffset} of the fair price.
 */
public class NoiseTrader extends AbstractTradingAgent {

    private final double probability;
    private final long minSize;
    private final long maxSize;
    private final double marketRatio;
    private final double limitOffset;

    public NoiseTrader(int id, String symbol, SimulationConfig config, Random random) {
        super(id, symbol, random);
        this.probability = config.noiseProbability();
        this.minSize = config.noiseMinSize();
        this.maxSize = config.noiseMaxSize();
        this.marketRatio = config.noiseMarketRatio();
        this.limitOffset = config.noiseLimitOffset();
    }

    @Override
    public AgentType type() {
        return AgentType.NOISE;
    }

    @Override
    public List<AgentAction> decide(AgentContext context) {
        if (random.nextDouble() >= probability) {
            return Collections.emptyList();
        }
        Side side = randomSide();
        long size = minSize + random.nextInt(Math.toIntExact(maxSize - minSize + 1));
        if (random.nextDouble() < marketRatio) {
            return List.of(AgentAction.submit(OrderRequest.market(symbol, side, size, ownerId())));
        }
        double offset = (random.nextDouble() * 2.0 - 1.0) * limitOffset;
        double price = roundToTick(context.fairPrice() * (1.0 + offset), context.tickSize(), side == Side.SELL);
        return List.of(AgentAction.submit(OrderRequest.limit(symbol, side, size, price, ownerId())));
    }
}
