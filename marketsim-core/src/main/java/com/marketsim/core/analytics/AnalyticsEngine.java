package com.marketsim.core.analytics;

import com.marketsim.api.AnalyticsSnapshot;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.Fill;
import com.marketsim.api.LiquidityRole;
import com.marketsim.api.Side;
import com.marketsim.core.SimulationConfig;
import com.marketsim.core.market.PriceWindow;

import java.util.ArrayDeque;
import java.util.Iterator;

/**
 * <b>Microstructure analytics for one symbol.</b>
 *
 * <table border="1">
 * <tr><th>Metric</th><th>Definition</th></tr>
 * <tr><td>Spread</td><td>best ask - best bid</td></tr>
 * <tr><td>Effective spread</td><td>mean of {@code 2 * d * (tradePrice - midAtTrade)} over the
 * trade window, d = +1 for taker buys, -1 for taker sells</td></tr>
 * <tr><td>Realized volatility</td><td>std of log returns of the per-tick reference price</td></tr>
 * <tr><td>Imbalance</td><td>bidQty / (bidQty + askQty) over the top N levels</td></tr>
 * <tr><td>VWAP</td><td>sum(price * qty) / sum(qty) over the trade window</td></tr>
 * <tr><td>Price impact</td><td>mean |relative change| between consecutive trade prices</td></tr>
 * </table>
 *
 * <p>
 * Trades are counted once, from the taker side. Recomputation happens at the
 * end of a tick, either every tick or once N new trades have accumulated
 * ({@link AnalyticsTrigger}); in between, the last snapshot stands.
 * </p>
 */
public class AnalyticsEngine {

    private final String symbol;
    private final AnalyticsTrigger trigger;
    private final int tradeInterval;
    private final int tradeWindow;
    private final int volatilityWindow;
    private final int levels;

    private final ArrayDeque<Fill> trades = new ArrayDeque<>();
    private final PriceWindow referencePrices;

    private long totalTrades;
    private long tradesSinceCompute;
    private AnalyticsSnapshot current;

    public AnalyticsEngine(String symbol, SimulationConfig config) {
        this.symbol = symbol;
        this.trigger = config.analyticsTrigger();
        this.tradeInterval = config.analyticsTradeInterval();
        this.tradeWindow = config.analyticsTradeWindow();
        this.volatilityWindow = config.analyticsVolatilityWindow();
        this.levels = config.analyticsLevels();
        this.referencePrices = new PriceWindow(volatilityWindow + 1);
        this.current = AnalyticsSnapshot.empty(symbol);
    }

    /**
     * Records the trade behind a taker fill. Maker fills are ignored.
     */
    public void onFill(Fill fill) {
        if (fill.role() != LiquidityRole.TAKER) {
            return;
        }
        trades.addLast(fill);
        if (trades.size() > tradeWindow) {
            trades.removeFirst();
        }
        totalTrades++;
        tradesSinceCompute++;
    }

    /**
     * Closes a tick: records the reference price and recomputes if the trigger says so.
     *
     * @return the current snapshot, fresh or not
     */
    public AnalyticsSnapshot endOfTick(BookSnapshot book, double referencePrice, long tick) {
        referencePrices.add(referencePrice);
        if (trigger == AnalyticsTrigger.EVERY_TICK || tradesSinceCompute >= tradeInterval) {
            current = compute(book, tick);
            tradesSinceCompute = 0;
        }
        return current;
    }

    public AnalyticsSnapshot compute(BookSnapshot book, long tick) {
        long bidDepth = book.depth(Side.BUY, levels);
        long askDepth = book.depth(Side.SELL, levels);
        double imbalance = bidDepth + askDepth == 0 ? Double.NaN : (double) bidDepth / (bidDepth + askDepth);

        return new AnalyticsSnapshot(symbol, book.spread(), effectiveSpread(),
                referencePrices.logReturnStdDev(volatilityWindow + 1), imbalance, vwap(),
                bidDepth, askDepth, priceImpact(), totalTrades, tick);
    }

    private double effectiveSpread() {
        double sum = 0;
        int n = 0;
        for (Fill fill : trades) {
            if (Double.isNaN(fill.midPriceAtTrade())) {
                continue;
            }
            sum += 2.0 * fill.side().sign() * (fill.price() - fill.midPriceAtTrade());
            n++;
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    private double vwap() {
        double notional = 0;
        long quantity = 0;
        for (Fill fill : trades) {
            notional += fill.price() * fill.quantity();
            quantity += fill.quantity();
        }
        return quantity == 0 ? Double.NaN : notional / quantity;
    }

    private double priceImpact() {
        if (trades.size() < 2) {
            return Double.NaN;
        }
        Iterator<Fill> it = trades.iterator();
        double previous = it.next().price();
        double sum = 0;
        int n = 0;
        while (it.hasNext()) {
            double price = it.next().price();
            sum += Math.abs(price / previous - 1.0);
            previous = price;
            n++;
        }
        return sum / n;
    }

    public AnalyticsSnapshot current() {
        return current;
    }

    public long totalTrades() {
        return totalTrades;
    }
}
