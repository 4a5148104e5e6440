package com.marketsim.api;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BookSnapshotTest {

    private final BookSnapshot snapshot = new BookSnapshot("TEST",
            List.of(new BookLevel(99.5, 100, 1), new BookLevel(99.0, 200, 1)),
            List.of(new BookLevel(100.5, 150, 1), new BookLevel(101.0, 250, 2)),
            Double.NaN, 0L, 3L);

    @Test
    void derivesTopOfBook() {
        assertEquals(99.5, snapshot.bestBid());
        assertEquals(100.5, snapshot.bestAsk());
        assertEquals(100.0, snapshot.midPrice(), 1e-9);
        assertEquals(1.0, snapshot.spread(), 1e-9);
        assertEquals(300, snapshot.bidDepth());
        assertEquals(400, snapshot.askDepth());
        assertEquals(150, snapshot.depth(Side.SELL, 1));
    }

    @Test
    void oneSidedBookHasNoMid() {
        BookSnapshot bidsOnly = new BookSnapshot("TEST", List.of(new BookLevel(99.5, 1, 1)), List.of(),
                Double.NaN, 0L, 0L);
        assertTrue(Double.isNaN(bidsOnly.midPrice()));
        assertTrue(Double.isNaN(bidsOnly.spread()));
        assertTrue(Double.isNaN(bidsOnly.bestAsk()));
    }

    @Test
    void rejectsMisorderedLevels() {
        assertThrows(IllegalArgumentException.class, () -> new BookSnapshot("TEST",
                List.of(new BookLevel(99.0, 1, 1), new BookLevel(99.5, 1, 1)), List.of(), Double.NaN, 0L, 0L));
        assertThrows(IllegalArgumentException.class, () -> new BookSnapshot("TEST", List.of(),
                List.of(new BookLevel(101.0, 1, 1), new BookLevel(101.0, 1, 1)), Double.NaN, 0L, 0L));
    }

    @Test
    void truncateKeepsBestLevels() {
        BookSnapshot top = snapshot.truncate(1);
        assertEquals(1, top.bids().size());
        assertEquals(1, top.asks().size());
        assertEquals(99.5, top.bestBid());
        assertSame(snapshot, snapshot.truncate(5));
    }
}
