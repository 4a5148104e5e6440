package com.marketsim.infra;

import com.marketsim.api.ErrorCode;
import com.marketsim.api.Fill;
import com.marketsim.api.OrderReport;
import com.marketsim.api.OrderRequest;
import com.marketsim.api.OrderStatus;
import com.marketsim.api.Result;
import com.marketsim.api.Side;
import com.marketsim.core.SimulationConfig;
import com.marketsim.core.SymbolEngine;
import com.marketsim.core.SymbolSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SymbolLaneTest {

    private final List<Fill> fills = new CopyOnWriteArrayList<>();
    private final RecordingJournal journal = new RecordingJournal();
    private SymbolLane lane;

    @BeforeEach
    void setUp() {
        lane = new SymbolLane("MSFT", 300.0, 2, SimulationConfig.builder().noAgents().build(), fills::add, journal);
        lane.start();
    }

    @AfterEach
    void tearDown() {
        lane.shutdown();
    }

    @Test
    void idsCarryTheLaneIndex() {
        long id = lane.submit(OrderRequest.limit("MSFT", Side.BUY, 10, 299.0, null)).join().value();

        assertEquals(SymbolEngine.idBase(2), id & ~((1L << 40) - 1));
        assertEquals(2, SymbolLane.indexOf(id));
        assertEquals(-1, SymbolLane.indexOf(42));
    }

    @Test
    void commandsRunInPublishOrder() {
        lane.submit(OrderRequest.limit("MSFT", Side.SELL, 10, 300.5, "maker"));
        lane.submit(OrderRequest.market("MSFT", Side.BUY, 4, "taker"));
        Result<SymbolSnapshot> tick = lane.tick().join();

        assertEquals(1, tick.value().tick());
        assertEquals(6, tick.value().book().asks().get(0).quantity());
        assertEquals(2, fills.size());
        assertEquals(2, lane.recentFills(10).join().value().size());
        assertSame(tick.value(), lane.snapshot());
    }

    @Test
    void refusalsComeBackAsResults() {
        assertEquals(ErrorCode.VALIDATION_ERROR,
                lane.submit(OrderRequest.limit("AAPL", Side.BUY, 10, 150.0, null)).join().error());
        assertEquals(ErrorCode.NOT_FOUND, lane.cancel(SymbolEngine.idBase(2) | 99).join().error());
        assertEquals(ErrorCode.NOT_FOUND, lane.getOrder(SymbolEngine.idBase(2) | 99).join().error());
        assertFalse(lane.isHalted());
    }

    @Test
    void eachCommandRepliesWithItsOwnType() {
        long id = lane.submit(OrderRequest.limit("MSFT", Side.BUY, 10, 299.0, "a")).join().value();

        OrderReport report = lane.getOrder(id).join().value();
        assertEquals(id, report.orderId());
        assertEquals(OrderStatus.OPEN, report.status());

        Result<Void> cancel = lane.cancel(id).join();
        assertTrue(cancel.isOk());
        assertNull(cancel.value());
        assertEquals(OrderStatus.CANCELLED, lane.getOrder(id).join().value().status());

        List<Fill> recent = lane.recentFills(3).join().value();
        assertTrue(recent.isEmpty());
    }

    @Test
    void haltedLaneAnswersEveryCommandWithHalted() {
        lane.submit(OrderRequest.limit("MSFT", Side.BUY, 10, 299.0, null)).join();
        lane.engine().book().bestBid().reduce(3);

        assertEquals(ErrorCode.LANE_HALTED, lane.tick().join().error());
        assertTrue(lane.isHalted());
        assertNotNull(lane.haltReason());
        assertEquals(List.of("MSFT"), journal.halts);
        assertEquals(ErrorCode.LANE_HALTED, lane.recentFills(5).join().error());
    }
}
