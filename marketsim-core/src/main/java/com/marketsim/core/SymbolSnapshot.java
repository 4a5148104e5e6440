package com.marketsim.core;

import com.marketsim.api.AnalyticsSnapshot;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.MarketState;

/**
 * Everything readers may see of one symbol, captured together on the lane
 * thread and published as a unit.
 */
public final class SymbolSnapshot {

    private final BookSnapshot book;
    private final MarketState state;
    private final AnalyticsSnapshot analytics;

    public SymbolSnapshot(BookSnapshot book, MarketState state, AnalyticsSnapshot analytics) {
        this.book = book;
        this.state = state;
        this.analytics = analytics;
    }

    public String symbol() {
        return state.symbol();
    }

    public long tick() {
        return state.tick();
    }

    public BookSnapshot book() {
        return book;
    }

    public MarketState state() {
        return state;
    }

    public AnalyticsSnapshot analytics() {
        return analytics;
    }
}
