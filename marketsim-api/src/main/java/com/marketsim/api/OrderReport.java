package com.marketsim.api;

/**
 * Point-in-time view of an order, handed to callers instead of the live order.
 */
public final class OrderReport {

    private final long orderId;
    private final String symbol;
    private final Side side;
    private final OrderType type;
    private final long quantity;
    private final long filledQuantity;
    private final double limitPrice;
    private final double stopPrice;
    private final double averageFillPrice;
    private final OrderStatus status;
    private final long timestamp;
    private final String ownerId;

    public OrderReport(long orderId, String symbol, Side side, OrderType type, long quantity, long filledQuantity,
            double limitPrice, double stopPrice, double averageFillPrice, OrderStatus status, long timestamp,
            String ownerId) {
        this.orderId = orderId;
        this.symbol = symbol;
        this.side = side;
        this.type = type;
        this.quantity = quantity;
        this.filledQuantity = filledQuantity;
        this.limitPrice = limitPrice;
        this.stopPrice = stopPrice;
        this.averageFillPrice = averageFillPrice;
        this.status = status;
        this.timestamp = timestamp;
        this.ownerId = ownerId;
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

    public OrderType type() {
        return type;
    }

    public long quantity() {
        return quantity;
    }

    public long filledQuantity() {
        return filledQuantity;
    }

    public long remainingQuantity() {
        return quantity - filledQuantity;
    }

    public double limitPrice() {
        return limitPrice;
    }

    public double stopPrice() {
        return stopPrice;
    }

    /**
     * NaN until the first fill.
     */
    public double averageFillPrice() {
        return averageFillPrice;
    }

    public OrderStatus status() {
        return status;
    }

    public long timestamp() {
        return timestamp;
    }

    public String ownerId() {
        return ownerId;
    }

    @Override
    public String toString() {
        return "OrderReport{" +
                "id=" + orderId +
                ", symbol=" + symbol +
                ", " + side + " " + type +
                ", qty=" + quantity +
                ", filled=" + filledQuantity +
                ", avg=" + averageFillPrice +
                ", status=" + status +
                '}';
    }
}
