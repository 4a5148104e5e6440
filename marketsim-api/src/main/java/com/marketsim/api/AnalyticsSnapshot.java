package com.marketsim.api;

/**
 * Microstructure metrics for one symbol. Any metric without enough data to be
 * defined (no trades yet, one-sided book) is NaN.
 */
public final class AnalyticsSnapshot {

    private final String symbol;
    private final double spread;
    private final double effectiveSpread;
    private final double realizedVolatility;
    private final double imbalance;
    private final double vwap;
    private final long bidDepth;
    private final long askDepth;
    private final double priceImpact;
    private final long tradeCount;
    private final long tick;

    public AnalyticsSnapshot(String symbol, double spread, double effectiveSpread, double realizedVolatility,
            double imbalance, double vwap, long bidDepth, long askDepth, double priceImpact, long tradeCount,
            long tick) {
        this.symbol = symbol;
        this.spread = spread;
        this.effectiveSpread = effectiveSpread;
        this.realizedVolatility = realizedVolatility;
        this.imbalance = imbalance;
        this.vwap = vwap;
        this.bidDepth = bidDepth;
        this.askDepth = askDepth;
        this.priceImpact = priceImpact;
        this.tradeCount = tradeCount;
        this.tick = tick;
    }

    public static AnalyticsSnapshot empty(String symbol) {
        return new AnalyticsSnapshot(symbol, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                0, 0, Double.NaN, 0, 0);
    }

    public String symbol() {
        return symbol;
    }

    public double spread() {
        return spread;
    }

    /**
     * Mean signed effective spread over the trade window.
     */
    public double effectiveSpread() {
        return effectiveSpread;
    }

    public double realizedVolatility() {
        return realizedVolatility;
    }

    /**
     * bid / (bid + ask) over the top levels; 0.5 is balanced.
     */
    public double imbalance() {
        return imbalance;
    }

    public double vwap() {
        return vwap;
    }

    public long bidDepth() {
        return bidDepth;
    }

    public long askDepth() {
        return askDepth;
    }

    /**
     * Mean absolute relative price change between consecutive trades.
     */
    public double priceImpact() {
        return priceImpact;
    }

    public long tradeCount() {
        return tradeCount;
    }

    public long tick() {
        return tick;
    }

    @Override
    public String toString() {
        return String.format("Analytics{%s tick=%d spread=%.4f eff=%.4f rv=%.6f imb=%.3f vwap=%.4f trades=%d}",
                symbol, tick, spread, effectiveSpread, realizedVolatility, imbalance, vwap, tradeCount);
    }
}
