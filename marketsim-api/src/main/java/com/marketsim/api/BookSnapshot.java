package com.marketsim.api;

import java.util.List;

/**
 * <b>Immutable view of one symbol's order book.</b>
 * <p>
 * Bids are held strictly descending by price and asks strictly ascending, so
 * index 0 is always the top of book. The constructor refuses level lists that
 * break that ordering.
 * </p>
 * Best prices, mid and spread are NaN when the side(s) they need are empty.
 */
public final class BookSnapshot {

    private final String symbol;
    private final List<BookLevel> bids;
    private final List<BookLevel> asks;
    private final double lastTradePrice;
    private final long timestamp;
    private final long tick;

    public BookSnapshot(String symbol, List<BookLevel> bids, List<BookLevel> asks, double lastTradePrice,
            long timestamp, long tick) {
        checkOrdering(bids, true);
        checkOrdering(asks, false);
        this.symbol = symbol;
        this.bids = List.copyOf(bids);
        this.asks = List.copyOf(asks);
        this.lastTradePrice = lastTradePrice;
        this.timestamp = timestamp;
        this.tick = tick;
    }

    public static BookSnapshot empty(String symbol) {
        return new BookSnapshot(symbol, List.of(), List.of(), Double.NaN, 0, 0);
    }

    private static void checkOrdering(List<BookLevel> levels, boolean descending) {
        for (int i = 1; i < levels.size(); i++) {
            double prev = levels.get(i - 1).price();
            double cur = levels.get(i).price();
            if (descending ? cur >= prev : cur <= prev) {
                throw new IllegalArgumentException("levels out of order at index " + i + ": " + prev + " then " + cur);
            }
        }
    }

    public String symbol() {
        return symbol;
    }

    public List<BookLevel> bids() {
        return bids;
    }

    public List<BookLevel> asks() {
        return asks;
    }

    public double lastTradePrice() {
        return lastTradePrice;
    }

    public long timestamp() {
        return timestamp;
    }

    public long tick() {
        return tick;
    }

    public double bestBid() {
        return bids.isEmpty() ? Double.NaN : bids.get(0).price();
    }

    public double bestAsk() {
        return asks.isEmpty() ? Double.NaN : asks.get(0).price();
    }

    public boolean isTwoSided() {
        return !bids.isEmpty() && !asks.isEmpty();
    }

    public double midPrice() {
        return isTwoSided() ? (bestBid() + bestAsk()) / 2.0 : Double.NaN;
    }

    public double spread() {
        return isTwoSided() ? bestAsk() - bestBid() : Double.NaN;
    }

    public long bidDepth() {
        return depth(bids, bids.size());
    }

    public long askDepth() {
        return depth(asks, asks.size());
    }

    /**
     * Resting quantity over the best {@code levels} price levels of one side.
     */
    public long depth(Side side, int levels) {
        return side == Side.BUY ? depth(bids, levels) : depth(asks, levels);
    }

    private static long depth(List<BookLevel> side, int levels) {
        long total = 0;
        int n = Math.min(levels, side.size());
        for (int i = 0; i < n; i++) {
            total += side.get(i).quantity();
        }
        return total;
    }

    /**
     * Keeps only the best {@code depth} levels per side.
     */
    public BookSnapshot truncate(int depth) {
        if (bids.size() <= depth && asks.size() <= depth) {
            return this;
        }
        return new BookSnapshot(symbol,
                bids.subList(0, Math.min(depth, bids.size())),
                asks.subList(0, Math.min(depth, asks.size())),
                lastTradePrice, timestamp, tick);
    }

    @Override
    public String toString() {
        return "BookSnapshot{" + symbol + " tick=" + tick + " bids=" + bids + " asks=" + asks + '}';
    }
}
