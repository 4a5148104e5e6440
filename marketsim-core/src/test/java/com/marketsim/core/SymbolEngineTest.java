package com.marketsim.core;

import com.marketsim.api.Fill;
import com.marketsim.api.OrderRequest;
import com.marketsim.api.OrderStatus;
import com.marketsim.api.Side;
import com.marketsim.core.execution.ExecutionListener;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolEngineTest {

    private static List<String> run(SimulationConfig config, int ticks) {
        List<String> trace = new ArrayList<>();
        SymbolEngine engine = new SymbolEngine("AAPL", 150.0, 0, config, null);
        for (int i = 0; i < ticks; i++) {
            SymbolSnapshot snap = engine.tick();
            trace.add(snap.state().lastPrice() + "/" + snap.state().volume() + "/" + snap.book().bestBid() + "/"
                    + snap.book().bestAsk());
        }
        for (Fill fill : engine.recentFills(50)) {
            trace.add(fill.fillId() + ":" + fill.ownerId() + ":" + fill.quantity() + "@" + fill.executionPrice());
        }
        return trace;
    }

    @Test
    void sameSeedReplaysIdentically() {
        SimulationConfig config = SimulationConfig.builder().seed(2024).build();

        assertEquals(run(config, 300), run(config, 300));
    }

    @Test
    void differentSeedDiverges() {
        assertNotEquals(run(SimulationConfig.builder().seed(1).build(), 100),
                run(SimulationConfig.builder().seed(2).build(), 100));
    }

    @Test
    void agentsBuildAndTradeATwoSidedMarket() {
        List<Fill> seen = new ArrayList<>();
        ExecutionListener downstream = seen::add;
        SymbolEngine engine = new SymbolEngine("MSFT", 300.0, 1, SimulationConfig.defaults(), downstream);

        SymbolSnapshot snap = null;
        for (int i = 0; i < 500; i++) {
            snap = engine.tick();
        }

        assertEquals(500, snap.tick());
        assertEquals(500 * 100_000_000L, snap.state().timestamp());
        assertTrue(snap.book().isTwoSided());
        assertTrue(snap.state().volume() > 0);
        assertTrue(snap.state().lastPrice() > 0);
        assertFalse(seen.isEmpty());
        assertEquals(SymbolEngine.idBase(1), seen.get(0).fillId() & ~((1L << 40) - 1));
        assertEquals(engine.execution().tradeCount(), snap.analytics().tradeCount());
        engine.book().verifyInvariants();
    }

    @Test
    void externalOrdersShowUpWithoutWaitingForATick() {
        SymbolEngine engine = new SymbolEngine("TEST", 100.0, 0, SimulationConfig.builder().noAgents().build(),
                null);

        long bid = engine.submit(OrderRequest.limit("TEST", Side.BUY, 100, 99.5, null));
        engine.submit(OrderRequest.limit("TEST", Side.SELL, 150, 100.5, null));

        assertEquals(99.5, engine.snapshot().book().bestBid());
        assertEquals(100.0, engine.snapshot().book().midPrice(), 1e-9);
        assertEquals(OrderStatus.OPEN, engine.getOrder(bid).status());
        assertEquals("external", engine.getOrder(bid).ownerId());

        assertTrue(engine.cancel(bid));
        assertTrue(Double.isNaN(engine.snapshot().book().bestBid()));
        assertFalse(engine.cancel(bid));
    }

    @Test
    void previousTickFlowMovesReferencePrice() {
        SimulationConfig config = SimulationConfig.builder().noAgents().volatility(0.0).momentumFactor(0.0)
                .meanReversionRate(0.0).anchorWeight(0.0).build();
        SymbolEngine engine = new SymbolEngine("TEST", 100.0, 0, config, null);
        engine.submit(OrderRequest.limit("TEST", Side.SELL, 1_000, 100.5, null));
        engine.submit(OrderRequest.market("TEST", Side.BUY, 1_000, null));

        double after = engine.tick().state().lastPrice();
        double next = engine.tick().state().lastPrice();

        assertTrue(after > 100.0);
        // Flow is consumed once
        assertEquals(after, next, 1e-12);
    }
}
