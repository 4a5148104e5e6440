package com.marketsim.core.book;

/**
 * Receives each trade the book executes, after both orders have been updated.
 */
public interface TradeListener {
    void onTrade(Order maker, Order taker, long priceTicks, long quantity);
}
