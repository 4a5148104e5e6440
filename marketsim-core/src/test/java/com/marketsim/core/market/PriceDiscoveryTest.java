package com.marketsim.core.market;

import com.marketsim.core.SimulationConfig;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PriceDiscoveryTest {

    private static PriceDiscovery discovery(SimulationConfig config, double price, long seed) {
        return new PriceDiscovery(config, price, new LiquidityModel(config), new Random(seed));
    }

    private static SimulationConfig.Builder quiet() {
        return SimulationConfig.builder().volatility(0.0).momentumFactor(0.0).meanReversionRate(0.0)
                .anchorWeight(0.0);
    }

    @Test
    void sameSeedSamePath() {
        SimulationConfig config = SimulationConfig.defaults();
        PriceDiscovery a = discovery(config, 100.0, 11);
        PriceDiscovery b = discovery(config, 100.0, 11);

        for (int i = 0; i < 200; i++) {
            long flow = (i % 7) * 13 - 40;
            assertEquals(a.step(flow, Double.NaN), b.step(flow, Double.NaN));
        }
        assertEquals(a.momentum(), b.momentum());
        assertEquals(a.realizedVolatility(), b.realizedVolatility());
    }

    @Test
    void priceStaysAboveFloor() {
        SimulationConfig config = SimulationConfig.builder().volatility(1.0).build();
        PriceDiscovery process = discovery(config, 1.0, 3);

        double previous = process.price();
        for (int i = 0; i < 500; i++) {
            double next = process.step(0, Double.NaN);
            assertTrue(next >= 0.5 * previous - 1e-12, "fell more than half at step " + i);
            assertTrue(next >= config.tickSize());
            previous = next;
        }
    }

    @Test
    void buyFlowPushesPriceUp() {
        PriceDiscovery process = discovery(quiet().build(), 100.0, 1);

        // 10_000 against a base of 10_000 with coefficient 0.1 is a 10% move
        assertEquals(110.0, process.step(10_000, Double.NaN), 1e-9);
        assertEquals(0.1, process.momentum(), 1e-12);
        assertTrue(process.step(-10_000, Double.NaN) < 110.0);
    }

    @Test
    void previewIsTheNextStepWithoutFlow() {
        PriceDiscovery process = discovery(SimulationConfig.builder().anchorWeight(0.0).build(), 100.0, 21);

        for (int i = 0; i < 100; i++) {
            double before = process.price();
            double preview = process.previewNextMove();
            assertEquals(before + preview, process.step(0, Double.NaN), 1e-9, "step " + i);
        }
    }

    @Test
    void previewLeavesOutFlowAndAnchor() {
        PriceDiscovery process = discovery(quiet().anchorWeight(1.0).build(), 100.0, 1);

        assertEquals(0.0, process.previewNextMove(), 1e-12);
        assertEquals(104.0, process.step(0, 104.0), 1e-9);
    }

    @Test
    void anchorPullsTowardMid() {
        PriceDiscovery full = discovery(quiet().anchorWeight(1.0).build(), 100.0, 1);
        PriceDiscovery half = discovery(quiet().anchorWeight(0.5).build(), 100.0, 1);

        assertEquals(105.0, full.step(0, 105.0), 1e-9);
        assertEquals(102.5, half.step(0, 105.0), 1e-9);
        // One-sided book: no anchor
        assertEquals(105.0, full.step(0, Double.NaN), 1e-9);
    }

    @Test
    void reportsConfiguredVolatilityUntilHistoryBuilds() {
        SimulationConfig config = SimulationConfig.defaults();
        PriceDiscovery process = discovery(config, 100.0, 5);

        for (int i = 0; i < 9; i++) {
            process.step(0, Double.NaN);
            assertEquals(config.volatility(), process.realizedVolatility());
        }
        for (int i = 0; i < 20; i++) {
            process.step(0, Double.NaN);
        }
        assertNotEquals(config.volatility(), process.realizedVolatility());
        assertEquals(30, process.history().size());
    }

    @Test
    void rejectsNonPositiveStart() {
        SimulationConfig config = SimulationConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> discovery(config, 0.0, 1));
        assertThrows(IllegalArgumentException.class, () -> discovery(config, Double.NaN, 1));
    }
}
