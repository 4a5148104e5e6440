package com.marketsim.core.analytics;

import com.marketsim.api.AnalyticsSnapshot;
import com.marketsim.api.BookLevel;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.Fill;
import com.marketsim.api.LiquidityRole;
import com.marketsim.api.Side;
import com.marketsim.core.SimulationConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalyticsEngineTest {

    private static final String SYMBOL = "TEST";

    private static BookSnapshot book() {
        return new BookSnapshot(SYMBOL,
                List.of(new BookLevel(99.5, 100, 1), new BookLevel(99.0, 200, 1)),
                List.of(new BookLevel(100.5, 150, 1), new BookLevel(101.0, 250, 1)),
                Double.NaN, 0, 1);
    }

    private static Fill taker(long id, Side side, long qty, double price, double executionPrice, double mid) {
        return new Fill(id, id, SYMBOL, side, qty, price, executionPrice, 0, LiquidityRole.TAKER, "x", mid);
    }

    @Test
    void bookMetrics() {
        AnalyticsEngine analytics = new AnalyticsEngine(SYMBOL, SimulationConfig.defaults());

        AnalyticsSnapshot snap = analytics.endOfTick(book(), 100.0, 1);

        assertEquals(1.0, snap.spread(), 1e-9);
        assertEquals(300, snap.bidDepth());
        assertEquals(400, snap.askDepth());
        assertEquals(300.0 / 700.0, snap.imbalance(), 1e-12);
        assertTrue(Double.isNaN(snap.vwap()));
        assertTrue(Double.isNaN(snap.effectiveSpread()));
        assertEquals(0, snap.tradeCount());
        assertEquals(1, snap.tick());
    }

    @Test
    void tradeMetricsCountTakersOnly() {
        AnalyticsEngine analytics = new AnalyticsEngine(SYMBOL, SimulationConfig.defaults());
        analytics.onFill(taker(1, Side.BUY, 100, 100.5, 100.6, 100.0));
        analytics.onFill(new Fill(2, 2, SYMBOL, Side.SELL, 100, 100.5, 100.5, 0, LiquidityRole.MAKER, "y", 100.0));
        analytics.onFill(taker(3, Side.SELL, 300, 99.5, 99.4, 100.0));

        AnalyticsSnapshot snap = analytics.endOfTick(book(), 100.0, 1);

        assertEquals(2, snap.tradeCount());
        assertEquals((100 * 100.5 + 300 * 99.5) / 400, snap.vwap(), 1e-9);
        // on trade prices: 2 * (+1) * 0.5 and 2 * (-1) * (-0.5)
        assertEquals(1.0, snap.effectiveSpread(), 1e-9);
        assertEquals(Math.abs(99.5 / 100.5 - 1), snap.priceImpact(), 1e-12);
    }

    @Test
    void tradeWindowBoundsHistory() {
        SimulationConfig config = SimulationConfig.builder().analyticsTradeWindow(2).build();
        AnalyticsEngine analytics = new AnalyticsEngine(SYMBOL, config);
        analytics.onFill(taker(1, Side.BUY, 10, 50.0, 50.0, Double.NaN));
        analytics.onFill(taker(2, Side.BUY, 10, 100.0, 100.0, Double.NaN));
        analytics.onFill(taker(3, Side.BUY, 10, 100.0, 100.0, Double.NaN));

        AnalyticsSnapshot snap = analytics.endOfTick(book(), 100.0, 1);

        assertEquals(100.0, snap.vwap(), 1e-12);
        assertEquals(0.0, snap.priceImpact(), 1e-12);
        assertEquals(3, snap.tradeCount());
        assertTrue(Double.isNaN(snap.effectiveSpread()));
    }

    @Test
    void volatilityFromReferencePrices() {
        AnalyticsEngine analytics = new AnalyticsEngine(SYMBOL, SimulationConfig.defaults());

        assertTrue(Double.isNaN(analytics.endOfTick(book(), 100.0, 1).realizedVolatility()));
        analytics.endOfTick(book(), 101.0, 2);
        AnalyticsSnapshot snap = analytics.endOfTick(book(), 100.0, 3);

        double up = Math.log(101.0 / 100.0);
        double down = Math.log(100.0 / 101.0);
        assertEquals(Math.abs(up - down) / 2, snap.realizedVolatility(), 1e-12);
    }

    @Test
    void tradeTriggerWaitsForEnoughTrades() {
        SimulationConfig config = SimulationConfig.builder().analyticsTrigger(AnalyticsTrigger.EVERY_N_TRADES)
                .analyticsTradeInterval(2).build();
        AnalyticsEngine analytics = new AnalyticsEngine(SYMBOL, config);

        analytics.onFill(taker(1, Side.BUY, 10, 100.0, 100.0, 100.0));
        AnalyticsSnapshot stale = analytics.endOfTick(book(), 100.0, 1);
        assertEquals(0, stale.tradeCount());
        assertTrue(Double.isNaN(stale.spread()));

        analytics.onFill(taker(2, Side.BUY, 10, 100.0, 100.0, 100.0));
        AnalyticsSnapshot fresh = analytics.endOfTick(book(), 100.0, 2);
        assertEquals(2, fresh.tradeCount());
        assertEquals(2, fresh.tick());
        assertSame(fresh, analytics.current());
    }
}
