package com.marketsim.core.market;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriceWindowTest {

    @Test
    void evictsOldestWhenFull() {
        PriceWindow window = new PriceWindow(3);
        for (double v : new double[] { 1, 2, 3, 4, 5 }) {
            window.add(v);
        }

        assertEquals(3, window.size());
        assertEquals(3.0, window.get(0));
        assertEquals(5.0, window.last());
        assertThrows(IndexOutOfBoundsException.class, () -> window.get(3));
    }

    @Test
    void meanUsesNewestValues() {
        PriceWindow window = new PriceWindow(10);
        window.add(10);
        window.add(20);
        window.add(30);

        assertEquals(25.0, window.mean(2), 1e-12);
        assertEquals(20.0, window.mean(50), 1e-12);
        assertTrue(Double.isNaN(new PriceWindow(2).mean(2)));
    }

    @Test
    void meanReturnNeedsFullLookback() {
        PriceWindow window = new PriceWindow(10);
        window.add(100);
        window.add(110);

        assertEquals(0.0, window.meanReturn(3));
        window.add(121);
        assertEquals(0.1, window.meanReturn(3), 1e-12);
    }

    @Test
    void logReturnStdDev() {
        PriceWindow window = new PriceWindow(10);
        window.add(100);
        window.add(101);
        assertTrue(Double.isNaN(window.logReturnStdDev(10)));

        // Constant growth: every log return is equal
        window.add(101.0 * 1.01);
        assertEquals(0.0, window.logReturnStdDev(10), 1e-12);

        window.add(90);
        assertTrue(window.logReturnStdDev(10) > 0);
    }
}
