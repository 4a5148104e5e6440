package com.marketsim.core.agent;

import com.marketsim.api.OrderRequest;
import com.marketsim.api.Side;
import com.marketsim.core.SimulationConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * <b>Market Maker.</b>
 * <p>
 * Keeps a bid and an ask around the fair price, {@code spread / 2} away on each
 * side. Every {@code requoteInterval} ticks it pulls both quotes and posts new
 * ones at the current fair price.
 * </p>
 * <h3>Inventory control</h3>
 * <ul>
 * <li>Both quotes shift against inventory by
 * {@code skew * (position / maxInventory) * halfSpread}, so a long maker sells
 * more readily than it buys, and vice versa.</li>
 * <li>A side whose fill would take the position past {@code maxInventory} is not quoted.</li>
 * </ul>
 */
public class MarketMaker extends AbstractTradingAgent {

    private final double spread;
    private final long quoteSize;
    private final int requoteInterval;
    private final long maxInventory;
    private final double inventorySkew;

    private final List<Long> liveQuotes = new ArrayList<>();
    private int ticksSinceQuote;

    public MarketMaker(int id, String symbol, SimulationConfig config, Random random) {
        super(id, symbol, random);
        this.spread = config.makerSpread();
        this.quoteSize = config.makerQuoteSize();
        this.requoteInterval = config.makerRequoteInterval();
        this.maxInventory = config.makerMaxInventory();
        this.inventorySkew = config.makerInventorySkew();
        this.ticksSinceQuote = requoteInterval;
    }

    @Override
    public AgentType type() {
        return AgentType.MARKET_MAKER;
    }

    @Override
    public List<AgentAction> decide(AgentContext context) {
        if (ticksSinceQuote < requoteInterval) {
            ticksSinceQuote++;
            return Collections.emptyList();
        }
        double fair = context.fairPrice();
        if (!(fair > 0)) {
            throw new AgentDecisionException(ownerId() + " has no price to quote around");
        }
        ticksSinceQuote = 1;

        List<AgentAction> actions = new ArrayList<>();
        for (Long quote : liveQuotes) {
            actions.add(AgentAction.cancel(quote));
        }
        liveQuotes.clear();

        double half = fair * spread / 2.0;
        double skew = -inventorySkew * ((double) position() / maxInventory) * half;
        double tick = context.tickSize();
        double bid = roundToTick(fair - half + skew, tick, false);
        double ask = roundToTick(fair + half + skew, tick, true);
        if (ask <= bid) {
            ask = bid + tick;
        }

        if (position() + quoteSize <= maxInventory) {
            actions.add(AgentAction.submit(OrderRequest.limit(symbol, Side.BUY, quoteSize, bid, ownerId())));
        }
        if (position() - quoteSize >= -maxInventory) {
            actions.add(AgentAction.submit(OrderRequest.limit(symbol, Side.SELL, quoteSize, ask, ownerId())));
        }
        return actions;
    }

    @Override
    public void onSubmitted(OrderRequest request, long orderId) {
        liveQuotes.add(orderId);
    }

    /**
     * Ids of the quotes posted at the last requote. Some may have filled since.
     */
    public List<Long> liveQuotes() {
        return Collections.unmodifiableList(liveQuotes);
    }
}
