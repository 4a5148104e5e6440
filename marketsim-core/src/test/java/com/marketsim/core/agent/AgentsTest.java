package com.marketsim.core.agent;

import com.marketsim.api.BookLevel;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.Fill;
import com.marketsim.api.LiquidityRole;
import com.marketsim.api.MarketState;
import com.marketsim.api.OrderRequest;
import com.marketsim.api.OrderType;
import com.marketsim.api.Side;
import com.marketsim.core.SimulationConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class AgentsTest {

    private static final String SYMBOL = "TEST";

    private static AgentContext context(double bid, double ask, double reference, double momentum, double drift) {
        BookSnapshot book = Double.isNaN(bid)
                ? BookSnapshot.empty(SYMBOL)
                : new BookSnapshot(SYMBOL, List.of(new BookLevel(bid, 100, 1)), List.of(new BookLevel(ask, 100, 1)),
                        Double.NaN, 0, 1);
        MarketState state = new MarketState(SYMBOL, reference, 0.001, momentum, 10_000, 0, Double.NaN, 1, 0);
        return new AgentContext(SYMBOL, 1, 0, book, state, drift, 0.01);
    }

    private static Fill fill(String owner, Side side, long qty, double price) {
        return new Fill(1, 1, SYMBOL, side, qty, price, price, 0, LiquidityRole.MAKER, owner, Double.NaN);
    }

    @Test
    void makerQuotesBothSidesAroundMid() {
        MarketMaker maker = new MarketMaker(1, SYMBOL, SimulationConfig.defaults(), new Random(1));

        List<AgentAction> actions = maker.decide(context(99.9, 100.1, 100.0, 0, 0));

        assertEquals(2, actions.size());
        OrderRequest bid = actions.get(0).request();
        OrderRequest ask = actions.get(1).request();
        assertEquals(Side.BUY, bid.side());
        assertEquals(99.95, bid.limitPrice(), 1e-9);
        assertEquals(Side.SELL, ask.side());
        assertEquals(100.05, ask.limitPrice(), 1e-9);
        assertEquals("mm-1", bid.ownerId());
    }

    @Test
    void makerCancelsOldQuotesWhenRequoting() {
        SimulationConfig config = SimulationConfig.builder().makerRequoteInterval(2).build();
        MarketMaker maker = new MarketMaker(1, SYMBOL, config, new Random(1));
        AgentContext context = context(99.9, 100.1, 100.0, 0, 0);

        List<AgentAction> first = maker.decide(context);
        maker.onSubmitted(first.get(0).request(), 11);
        maker.onSubmitted(first.get(1).request(), 12);

        assertTrue(maker.decide(context).isEmpty());
        List<AgentAction> requote = maker.decide(context);

        assertEquals(4, requote.size());
        assertEquals(AgentAction.Kind.CANCEL, requote.get(0).kind());
        assertEquals(11, requote.get(0).orderId());
        assertEquals(12, requote.get(1).orderId());
        assertTrue(maker.liveQuotes().isEmpty());
    }

    @Test
    void makerStopsBuyingAtInventoryLimit() {
        SimulationConfig config = SimulationConfig.builder().makerMaxInventory(100).build();
        MarketMaker maker = new MarketMaker(1, SYMBOL, config, new Random(1));
        maker.onFill(fill("mm-1", Side.BUY, 50, 100.0));

        List<AgentAction> actions = maker.decide(context(99.9, 100.1, 100.0, 0, 0));

        assertEquals(1, actions.size());
        assertEquals(Side.SELL, actions.get(0).request().side());
        // Long inventory skews the quote down
        assertTrue(actions.get(0).request().limitPrice() < 100.05);
    }

    @Test
    void makerWithoutPriceFails() {
        MarketMaker maker = new MarketMaker(1, SYMBOL, SimulationConfig.defaults(), new Random(1));

        assertThrows(AgentDecisionException.class,
                () -> maker.decide(context(Double.NaN, Double.NaN, Double.NaN, 0, 0)));
    }

    @Test
    void makerFallsBackToReferencePrice() {
        MarketMaker maker = new MarketMaker(1, SYMBOL, SimulationConfig.defaults(), new Random(1));

        List<AgentAction> actions = maker.decide(context(Double.NaN, Double.NaN, 200.0, 0, 0));

        assertEquals(199.9, actions.get(0).request().limitPrice(), 1e-9);
        assertEquals(200.1, actions.get(1).request().limitPrice(), 1e-9);
    }

    @Test
    void noiseTraderSendsSizedMarketOrders() {
        SimulationConfig config = SimulationConfig.builder().noiseProbability(1.0).noiseMarketRatio(1.0).build();
        NoiseTrader trader = new NoiseTrader(7, SYMBOL, config, new Random(3));

        for (int i = 0; i < 100; i++) {
            List<AgentAction> actions = trader.decide(context(99.9, 100.1, 100.0, 0, 0));
            assertEquals(1, actions.size());
            OrderRequest request = actions.get(0).request();
            assertEquals(OrderType.MARKET, request.type());
            assertTrue(request.quantity() >= 10 && request.quantity() <= 50);
            assertEquals("noise-7", request.ownerId());
        }
    }

    @Test
    void noiseTraderDrawsAcrossTheWidestAllowedRange() {
        SimulationConfig config = SimulationConfig.builder().noiseProbability(1.0).noiseMarketRatio(1.0)
                .noiseMinSize(1).noiseMaxSize(OrderRequest.MAX_QUANTITY).build();
        NoiseTrader trader = new NoiseTrader(7, SYMBOL, config, new Random(5));

        long largest = 0;
        for (int i = 0; i < 50; i++) {
            long qty = trader.decide(context(99.9, 100.1, 100.0, 0, 0)).get(0).request().quantity();
            assertTrue(qty >= 1 && qty <= OrderRequest.MAX_QUANTITY, "qty " + qty);
            largest = Math.max(largest, qty);
        }
        assertTrue(largest > 1_000_000, "largest " + largest);
    }

    @Test
    void noiseTraderLimitsStayNearFairPrice() {
        SimulationConfig config = SimulationConfig.builder().noiseProbability(1.0).noiseMarketRatio(0.0).build();
        NoiseTrader trader = new NoiseTrader(7, SYMBOL, config, new Random(3));

        for (int i = 0; i < 100; i++) {
            OrderRequest request = trader.decide(context(99.9, 100.1, 100.0, 0, 0)).get(0).request();
            assertEquals(OrderType.LIMIT, request.type());
            assertTrue(request.limitPrice() >= 98.99 && request.limitPrice() <= 101.01, "price " + request.limitPrice());
        }
    }

    @Test
    void idleTradersDoNothing() {
        SimulationConfig config = SimulationConfig.builder().noiseProbability(0.0).informedProbability(0.0)
                .momentumProbability(0.0).build();
        AgentContext context = context(99.9, 100.1, 100.0, 0.5, 50.0);

        assertTrue(new NoiseTrader(1, SYMBOL, config, new Random(1)).decide(context).isEmpty());
        assertTrue(new InformedTrader(2, SYMBOL, config, new Random(1)).decide(context).isEmpty());
        assertTrue(new MomentumTrader(3, SYMBOL, config, new Random(1)).decide(context).isEmpty());
    }

    @Test
    void informedTraderFollowsStrongSignal() {
        SimulationConfig config = SimulationConfig.builder().informedProbability(1.0).informedSignalNoise(0.0)
                .build();
        InformedTrader trader = new InformedTrader(2, SYMBOL, config, new Random(1));

        List<AgentAction> up = trader.decide(context(99.9, 100.1, 100.0, 0, 1.0));
        List<AgentAction> down = trader.decide(context(99.9, 100.1, 100.0, 0, -1.0));
        List<AgentAction> weak = trader.decide(context(99.9, 100.1, 100.0, 0, 0.05));

        assertEquals(Side.BUY, up.get(0).request().side());
        assertEquals(OrderType.MARKET, up.get(0).request().type());
        assertEquals(75, up.get(0).request().quantity());
        assertEquals(Side.SELL, down.get(0).request().side());
        assertTrue(weak.isEmpty());
    }

    @Test
    void momentumTraderCrossesTheSpreadInTrendDirection() {
        SimulationConfig config = SimulationConfig.builder().momentumProbability(1.0).build();
        MomentumTrader trader = new MomentumTrader(3, SYMBOL, config, new Random(1));

        OrderRequest buy = trader.decide(context(99.9, 100.1, 100.0, 0.01, 0)).get(0).request();
        OrderRequest sell = trader.decide(context(99.9, 100.1, 100.0, -0.01, 0)).get(0).request();

        assertEquals(Side.BUY, buy.side());
        assertEquals(OrderType.LIMIT, buy.type());
        assertTrue(buy.limitPrice() >= 100.1);
        assertEquals(Side.SELL, sell.side());
        assertTrue(sell.limitPrice() <= 99.9);
        assertTrue(trader.decide(context(99.9, 100.1, 100.0, 0.0001, 0)).isEmpty());
    }

    @Test
    void fillsUpdatePositionAndCash() {
        NoiseTrader trader = new NoiseTrader(1, SYMBOL, SimulationConfig.defaults(), new Random(1));

        trader.onFill(fill("noise-1", Side.BUY, 10, 100.0));
        trader.onFill(fill("noise-1", Side.SELL, 4, 101.0));

        assertEquals(6, trader.position());
        assertEquals(-1000.0 + 404.0, trader.cash(), 1e-9);
        assertEquals(14, trader.filledQuantity());
    }
}
