package com.marketsim.api;

/**
 * One side of a trade. Every match produces two fills with the same quantity
 * and book price: one for the resting order (MAKER) and one for the incoming
 * order (TAKER).
 * <p>
 * {@code price} is the book price the trade printed at. {@code executionPrice}
 * is what the owner actually paid or received after slippage and size impact;
 * for makers the two are equal.
 * </p>
 */
public final class Fill {

    private final long fillId;
    private final long orderId;
    private final String symbol;
    private final Side side;
    private final long quantity;
    private final double price;
    private final double executionPrice;
    private final long timestamp;
    private final LiquidityRole role;
    private final String ownerId;
    private final double midPriceAtTrade;

    public Fill(long fillId, long orderId, String symbol, Side side, long quantity, double price,
            double executionPrice, long timestamp, LiquidityRole role, String ownerId, double midPriceAtTrade) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("fill quantity must be positive: " + quantity);
        }
        this.fillId = fillId;
        this.orderId = orderId;
        this.symbol = symbol;
        this.side = side;
        this.quantity = quantity;
        this.price = price;
        this.executionPrice = executionPrice;
        this.timestamp = timestamp;
        this.role = role;
        this.ownerId = ownerId;
        this.midPriceAtTrade = midPriceAtTrade;
    }

    public long fillId() {
        return fillId;
    }

    public long orderId() {
        return orderId;
    }

    public String symbol() {
        return symbol;
    }

    public Side side() {
        return side;
    }

    public long quantity() {
        return quantity;
    }

    public double price() {
        return price;
    }

    public double executionPrice() {
        return executionPrice;
    }

    /**
     * Simulated nanos, including modelled execution latency.
     */
    public long timestamp() {
        return timestamp;
    }

    public LiquidityRole role() {
        return role;
    }

    public String ownerId() {
        return ownerId;
    }

    /**
     * Book mid immediately before the trade, NaN when the book was one-sided.
     */
    public double midPriceAtTrade() {
        return midPriceAtTrade;
    }

    public double notional() {
        return executionPrice * quantity;
    }

    @Override
    public String toString() {
        return "Fill{" +
                "fillId=" + fillId +
                ", orderId=" + orderId +
                ", symbol=" + symbol +
                ", side=" + side +
                ", qty=" + quantity +
                ", price=" + price +
                ", execPrice=" + executionPrice +
                ", role=" + role +
                ", owner=" + ownerId +
                '}';
    }
}
