package com.marketsim.core;

import com.marketsim.api.OrderRequest;
import com.marketsim.core.analytics.AnalyticsTrigger;
import com.marketsim.core.execution.MarketRemainderPolicy;
import com.marketsim.core.execution.SlippageModel;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class SimulationConfigTest {

    @Test
    void defaultsAreValid() {
        SimulationConfig config = SimulationConfig.defaults();

        assertEquals(100, config.tickIntervalMillis());
        assertEquals(100_000_000L, config.tickIntervalNanos());
        assertEquals(0.01, config.tickSize());
        assertEquals(SlippageModel.SQUARE_ROOT, config.slippageModel());
        assertEquals(MarketRemainderPolicy.CANCEL, config.marketRemainderPolicy());
        assertEquals(AnalyticsTrigger.EVERY_TICK, config.analyticsTrigger());
        assertEquals(40, config.totalAgents());
    }

    @Test
    void loadsOverridesFromClasspath() {
        SimulationConfig config = SimulationConfig.load(SimulationConfig.DEFAULT_RESOURCE);

        assertEquals(7, config.seed());
        assertEquals(0.05, config.tickSize());
        assertEquals(SlippageModel.LINEAR, config.slippageModel());
        assertEquals(MarketRemainderPolicy.LEAVE_UNFILLED, config.marketRemainderPolicy());
        assertEquals(3, config.noiseTraders());
        assertEquals(5, config.marketMakers());
    }

    @Test
    void missingResourceMeansDefaults() {
        SimulationConfig config = SimulationConfig.load("no-such-file.properties");

        assertEquals(SimulationConfig.defaults().seed(), config.seed());
    }

    @Test
    void rejectsUnparseableValue() {
        Properties p = new Properties();
        p.setProperty("marketsim.book.max.depth", "deep");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SimulationConfig.fromProperties(p));
        assertTrue(e.getMessage().contains("marketsim.book.max.depth"));
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> SimulationConfig.builder().laneRingSize(1000).build());
        assertThrows(IllegalArgumentException.class, () -> SimulationConfig.builder().anchorWeight(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> SimulationConfig.builder().tickSize(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> SimulationConfig.builder().noiseMinSize(60).noiseMaxSize(50).build());
    }

    @Test
    void agentSizesStayWithinTheOrderCap() {
        assertThrows(IllegalArgumentException.class,
                () -> SimulationConfig.builder().noiseMinSize(1).noiseMaxSize(Long.MAX_VALUE).build());
        assertThrows(IllegalArgumentException.class,
                () -> SimulationConfig.builder().noiseMaxSize(5_000_000_000L).build());
        assertThrows(IllegalArgumentException.class,
                () -> SimulationConfig.builder().makerQuoteSize(OrderRequest.MAX_QUANTITY + 1).build());
        assertThrows(IllegalArgumentException.class,
                () -> SimulationConfig.builder().momentumSize(OrderRequest.MAX_QUANTITY + 1).build());

        SimulationConfig widest = SimulationConfig.builder().noiseMinSize(1).noiseMaxSize(OrderRequest.MAX_QUANTITY)
                .build();
        assertEquals(OrderRequest.MAX_QUANTITY, widest.noiseMaxSize());
    }

    @Test
    void toBuilderKeepsValues() {
        SimulationConfig base = SimulationConfig.builder().seed(99).noAgents().build();

        SimulationConfig copy = base.toBuilder().volatility(0.0).build();

        assertEquals(99, copy.seed());
        assertEquals(0, copy.totalAgents());
        assertEquals(0.0, copy.volatility());
    }

    @Test
    void seedsDifferPerSymbolAndStream() {
        long a = Seeds.derive(42, "AAPL", 0);

        assertEquals(a, Seeds.derive(42, "AAPL", 0));
        assertNotEquals(a, Seeds.derive(42, "MSFT", 0));
        assertNotEquals(a, Seeds.derive(42, "AAPL", 1));
        assertNotEquals(a, Seeds.derive(43, "AAPL", 0));
    }
}
