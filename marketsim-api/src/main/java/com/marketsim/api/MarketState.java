package com.marketsim.api;

/**
 * Per-symbol market state after a tick: the reference price from price
 * discovery, its volatility and momentum, the liquidity model's current level,
 * and trade statistics.
 */
public final class MarketState {

    private final String symbol;
    private final double lastPrice;
    private final double volatility;
    private final double momentum;
    private final double liquidity;
    private final long volume;
    private final double lastTradePrice;
    private final long tick;
    private final long timestamp;

    public MarketState(String symbol, double lastPrice, double volatility, double momentum, double liquidity,
            long volume, double lastTradePrice, long tick, long timestamp) {
        this.symbol = symbol;
        this.lastPrice = lastPrice;
        this.volatility = volatility;
        this.momentum = momentum;
        this.liquidity = liquidity;
        this.volume = volume;
        this.lastTradePrice = lastTradePrice;
        this.tick = tick;
        this.timestamp = timestamp;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * The reference price.
     */
    public double lastPrice() {
        return lastPrice;
    }

    public double volatility() {
        return volatility;
    }

    public double momentum() {
        return momentum;
    }

    public double liquidity() {
        return liquidity;
    }

    /**
     * Cumulative traded quantity since the symbol was added.
     */
    public long volume() {
        return volume;
    }

    /**
     * NaN until the first trade.
     */
    public double lastTradePrice() {
        return lastTradePrice;
    }

    public long tick() {
        return tick;
    }

    public long timestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MarketState)) {
            return false;
        }
        MarketState that = (MarketState) o;
        return Double.compare(lastPrice, that.lastPrice) == 0
                && Double.compare(volatility, that.volatility) == 0
                && Double.compare(momentum, that.momentum) == 0
                && Double.compare(liquidity, that.liquidity) == 0
                && volume == that.volume
                && Double.compare(lastTradePrice, that.lastTradePrice) == 0
                && tick == that.tick
                && timestamp == that.timestamp
                && symbol.equals(that.symbol);
    }

    @Override
    public int hashCode() {
        int h = symbol.hashCode();
        h = 31 * h + Double.hashCode(lastPrice);
        h = 31 * h + Long.hashCode(volume);
        h = 31 * h + Long.hashCode(tick);
        return h;
    }

    @Override
    public String toString() {
        return String.format("MarketState{%s tick=%d price=%.4f vol=%.6f mom=%.6f liq=%.1f volume=%d last=%.4f}",
                symbol, tick, lastPrice, volatility, momentum, liquidity, volume, lastTradePrice);
    }
}
