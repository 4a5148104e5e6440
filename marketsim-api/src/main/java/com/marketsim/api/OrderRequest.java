package com.marketsim.api;

import java.util.Objects;

/**
 * An order as submitted by a caller or a simulated agent.
 * <p>
 * The constructor rejects anything the book could not accept, so an instance
 * is always a well-formed request: positive quantity up to {@link #MAX_QUANTITY}, a positive finite limit
 * price exactly when the type needs one, likewise for the stop price.
 * Prices are in quote units (e.g. 100.25); the engine snaps them to its tick grid.
 * </p>
 */
public final class OrderRequest {

    public static final double NO_PRICE = Double.NaN;

    /**
     * Largest quantity one order may carry. Level totals and fill notionals
     * stay far from {@code long} overflow below it.
     */
    public static final long MAX_QUANTITY = 1_000_000_000L;

    private final String symbol;
    private final Side side;
    private final OrderType type;
    private final long quantity;
    private final double limitPrice;
    private final double stopPrice;
    private final String ownerId;

    public OrderRequest(String symbol, Side side, OrderType type, long quantity,
            double limitPrice, double stopPrice, String ownerId) {
        if (symbol == null || symbol.isBlank()) {
            throw new OrderValidationException("symbol is required");
        }
        if (side == null || type == null) {
            throw new OrderValidationException("side and type are required");
        }
        if (quantity <= 0) {
            throw new OrderValidationException("quantity must be positive: " + quantity);
        }
        if (quantity > MAX_QUANTITY) {
            throw new OrderValidationException("quantity " + quantity + " exceeds the maximum of " + MAX_QUANTITY);
        }
        checkPrice("limit", type.requiresLimitPrice(), limitPrice, type);
        checkPrice("stop", type.requiresStopPrice(), stopPrice, type);

        this.symbol = symbol;
        this.side = side;
        this.type = type;
        this.quantity = quantity;
        this.limitPrice = type.requiresLimitPrice() ? limitPrice : NO_PRICE;
        this.stopPrice = type.requiresStopPrice() ? stopPrice : NO_PRICE;
        this.ownerId = ownerId == null ? "external" : ownerId;
    }

    private static void checkPrice(String name, boolean required, double price, OrderType type) {
        if (required) {
            if (Double.isNaN(price) || Double.isInfinite(price) || price <= 0) {
                throw new OrderValidationException(type + " order needs a positive " + name + " price, got " + price);
            }
        } else if (!Double.isNaN(price)) {
            throw new OrderValidationException(type + " order must not carry a " + name + " price");
        }
    }

    public static OrderRequest market(String symbol, Side side, long quantity, String ownerId) {
        return new OrderRequest(symbol, side, OrderType.MARKET, quantity, NO_PRICE, NO_PRICE, ownerId);
    }

    public static OrderRequest limit(String symbol, Side side, long quantity, double price, String ownerId) {
        return new OrderRequest(symbol, side, OrderType.LIMIT, quantity, price, NO_PRICE, ownerId);
    }

    public static OrderRequest stop(String symbol, Side side, long quantity, double stopPrice, String ownerId) {
        return new OrderRequest(symbol, side, OrderType.STOP, quantity, NO_PRICE, stopPrice, ownerId);
    }

    public static OrderRequest stopLimit(String symbol, Side side, long quantity, double stopPrice,
            double limitPrice, String ownerId) {
        return new OrderRequest(symbol, side, OrderType.STOP_LIMIT, quantity, limitPrice, stopPrice, ownerId);
    }

    public String symbol() {
        return symbol;
    }

    public Side side() {
        return side;
    }

    public OrderType type() {
        return type;
    }

    public long quantity() {
        return quantity;
    }

    /**
     * @return the limit price, or NaN for MARKET and STOP orders
     */
    public double limitPrice() {
        return limitPrice;
    }

    /**
     * @return the stop trigger price, or NaN for MARKET and LIMIT orders
     */
    public double stopPrice() {
        return stopPrice;
    }

    public String ownerId() {
        return ownerId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OrderRequest)) {
            return false;
        }
        OrderRequest that = (OrderRequest) o;
        return quantity == that.quantity
                && Double.compare(limitPrice, that.limitPrice) == 0
                && Double.compare(stopPrice, that.stopPrice) == 0
                && symbol.equals(that.symbol)
                && side == that.side
                && type == that.type
                && ownerId.equals(that.ownerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, side, type, quantity, limitPrice, stopPrice, ownerId);
    }

    @Override
    public String toString() {
        return "OrderRequest{" +
                "symbol=" + symbol +
                ", side=" + side +
                ", type=" + type +
                ", qty=" + quantity +
                ", limit=" + limitPrice +
                ", stop=" + stopPrice +
                ", owner=" + ownerId +
                '}';
    }
}
