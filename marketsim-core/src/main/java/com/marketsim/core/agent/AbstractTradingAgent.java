package com.marketsim.core.agent;

import com.marketsim.api.Fill;
import com.marketsim.api.OrderRequest;
import com.marketsim.api.Side;

import java.util.Random;

/**
 * Identity, random source and position/cash accounting shared by all agents.
 */
public abstract class AbstractTradingAgent implements TradingAgent {

    protected final int id;
    protected final String symbol;
    protected final Random random;
    private final String ownerId;

    private long position;
    private double cash;
    private long filledQuantity;

    protected AbstractTradingAgent(int id, String symbol, Random random) {
        this.id = id;
        this.symbol = symbol;
        this.random = random;
        this.ownerId = type().prefix() + "-" + id;
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public String ownerId() {
        return ownerId;
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public double cash() {
        return cash;
    }

    public long filledQuantity() {
        return filledQuantity;
    }

    @Override
    public void onSubmitted(OrderRequest request, long orderId) {
    }

    @Override
    public void onFill(Fill fill) {
        int sign = fill.side().sign();
        position += sign * fill.quantity();
        cash -= sign * fill.notional();
        filledQuantity += fill.quantity();
    }

    protected Side randomSide() {
        return random.nextBoolean() ? Side.BUY : Side.SELL;
    }

    /**
     * Rounds onto the tick grid, never below one tick.
     */
    protected static double roundToTick(double price, double tickSize, boolean up) {
        double ticks = price / tickSize;
        double rounded = up ? Math.ceil(ticks - 1e-9) : Math.floor(ticks + 1e-9);
        return Math.max(rounded, 1.0) * tickSize;
    }

    @Override
    public String toString() {
        return ownerId + "{position=" + position + ", cash=" + String.format("%.2f", cash) + '}';
    }
}
