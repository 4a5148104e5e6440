package com.marketsim.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OrderRequestTest {

    @Test
    void shouldBuildEachOrderType() {
        OrderRequest market = OrderRequest.market("TEST", Side.BUY, 10, "alice");
        assertEquals(OrderType.MARKET, market.type());
        assertTrue(Double.isNaN(market.limitPrice()));
        assertTrue(Double.isNaN(market.stopPrice()));

        OrderRequest limit = OrderRequest.limit("TEST", Side.SELL, 5, 100.5, "bob");
        assertEquals(100.5, limit.limitPrice());
        assertTrue(Double.isNaN(limit.stopPrice()));

        OrderRequest stop = OrderRequest.stop("TEST", Side.SELL, 5, 98.0, null);
        assertEquals(98.0, stop.stopPrice());
        assertEquals("external", stop.ownerId());

        OrderRequest stopLimit = OrderRequest.stopLimit("TEST", Side.BUY, 5, 101.0, 101.5, "carol");
        assertEquals(101.0, stopLimit.stopPrice());
        assertEquals(101.5, stopLimit.limitPrice());
    }

    @Test
    void shouldRejectNonPositiveQuantity() {
        assertThrows(OrderValidationException.class, () -> OrderRequest.market("TEST", Side.BUY, 0, "x"));
        assertThrows(OrderValidationException.class, () -> OrderRequest.limit("TEST", Side.BUY, -3, 100.0, "x"));
    }

    @Test
    void shouldCapQuantity() {
        OrderRequest largest = OrderRequest.market("TEST", Side.BUY, OrderRequest.MAX_QUANTITY, "x");
        assertEquals(OrderRequest.MAX_QUANTITY, largest.quantity());
        assertThrows(OrderValidationException.class,
                () -> OrderRequest.market("TEST", Side.BUY, OrderRequest.MAX_QUANTITY + 1, "x"));
        assertThrows(OrderValidationException.class,
                () -> OrderRequest.limit("TEST", Side.SELL, Long.MAX_VALUE, 100.0, "x"));
    }

    @Test
    void shouldRejectMissingOrInvalidPrices() {
        assertThrows(OrderValidationException.class, () -> OrderRequest.limit("TEST", Side.BUY, 1, Double.NaN, "x"));
        assertThrows(OrderValidationException.class, () -> OrderRequest.limit("TEST", Side.BUY, 1, 0.0, "x"));
        assertThrows(OrderValidationException.class,
                () -> OrderRequest.limit("TEST", Side.BUY, 1, Double.POSITIVE_INFINITY, "x"));
        assertThrows(OrderValidationException.class, () -> OrderRequest.stop("TEST", Side.SELL, 1, -1.0, "x"));
        assertThrows(OrderValidationException.class,
                () -> new OrderRequest("TEST", Side.BUY, OrderType.MARKET, 1, 100.0, Double.NaN, "x"));
    }

    @Test
    void shouldRejectBlankSymbol() {
        assertThrows(OrderValidationException.class, () -> OrderRequest.market(" ", Side.BUY, 1, "x"));
        assertThrows(OrderValidationException.class, () -> OrderRequest.market(null, Side.BUY, 1, "x"));
    }

    @Test
    void validationFailureIsAnIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> OrderRequest.market("TEST", null, 1, "x"));
    }

    @Test
    void equalRequestsAreEqual() {
        assertEquals(OrderRequest.limit("TEST", Side.BUY, 1, 99.5, "a"),
                OrderRequest.limit("TEST", Side.BUY, 1, 99.5, "a"));
        assertNotEquals(OrderRequest.limit("TEST", Side.BUY, 1, 99.5, "a"),
                OrderRequest.limit("TEST", Side.BUY, 1, 99.0, "a"));
    }
}
