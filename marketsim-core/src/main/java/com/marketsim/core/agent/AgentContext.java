package com.marketsim.core.agent;

import com.marketsim.api.BookSnapshot;
import com.marketsim.api.MarketState;

/**
 * What an agent may look at when it decides: read-only snapshots taken at the
 * start of its turn, never the live book.
 */
public final class AgentContext {

    private final String symbol;
    private final long tick;
    private final long timestamp;
    private final BookSnapshot book;
    private final MarketState state;
    private final double nextMove;
    private final double tickSize;

    public AgentContext(String symbol, long tick, long timestamp, BookSnapshot book, MarketState state,
            double nextMove, double tickSize) {
        this.symbol = symbol;
        this.tick = tick;
        this.timestamp = timestamp;
        this.book = book;
        this.state = state;
        this.nextMove = nextMove;
        this.tickSize = tickSize;
    }

    public String symbol() {
        return symbol;
    }

    public long tick() {
        return tick;
    }

    public long timestamp() {
        return timestamp;
    }

    public BookSnapshot book() {
        return book;
    }

    public MarketState state() {
        return state;
    }

    /**
     * Preview of the next reference price move, in price units, without the
     * flow this tick will add.
     */
    public double nextMove() {
        return nextMove;
    }

    public double tickSize() {
        return tickSize;
    }

    public double referencePrice() {
        return state.lastPrice();
    }

    /**
     * The price to trade around: the book mid when both sides are quoted,
     * otherwise the reference price.
     */
    public double fairPrice() {
        return book.isTwoSided() ? book.midPrice() : state.lastPrice();
    }
}
