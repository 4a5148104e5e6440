package com.marketsim.core.book;

import com.marketsim.api.OrderStatus;
import com.marketsim.api.OrderType;
import com.marketsim.api.Side;
import com.marketsim.core.InvariantViolationException;

/**
 * The engine's mutable order. Lives in the {@link OrderArena} while it rests
 * and in the execution engine's history once terminal.
 * <p>
 * Prices are in ticks; {@link #NO_PRICE} marks an absent limit or stop price.
 * Fills and status changes go through {@link #recordFill} and
 * {@link #transitionTo}, which refuse anything that would break
 * {@code 0 <= filled <= quantity} or the lifecycle.
 * </p>
 */
public class Order {

    public static final long NO_PRICE = Long.MIN_VALUE;

    private final long id;
    private final String symbol;
    private final Side side;
    private OrderType type;
    private final long quantity;
    private final long limitPrice;
    private final long stopPrice;
    private final long timestamp;
    private final String ownerId;

    private long filled;
    private double filledNotional;
    private OrderStatus status = OrderStatus.PENDING;

    public Order(long id, String symbol, Side side, OrderType type, long quantity, long limitPrice, long stopPrice,
            long timestamp, String ownerId) {
        this.id = id;
        this.symbol = symbol;
        this.side = side;
        this.type = type;
        this.quantity = quantity;
        this.limitPrice = limitPrice;
        this.stopPrice = stopPrice;
        this.timestamp = timestamp;
        this.ownerId = ownerId;
    }

    /**
     * Adds {@code qty} lots executed at {@code priceTicks} and moves the status
     * to PARTIALLY_FILLED or FILLED.
     */
    public void recordFill(long qty, long priceTicks) {
        if (qty <= 0 || filled + qty > quantity) {
            throw new InvariantViolationException("fill of " + qty + " would take order " + id
                    + " to " + (filled + qty) + "/" + quantity, toString());
        }
        filled += qty;
        filledNotional += (double) qty * priceTicks;
        transitionTo(filled == quantity ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED);
    }

    public void transitionTo(OrderStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new InvariantViolationException("order " + id + " cannot go " + status + " -> " + next,
                    toString());
        }
        status = next;
    }

    /**
     * Turns a triggered stop into the order it stands for (STOP becomes MARKET,
     * STOP_LIMIT becomes LIMIT).
     */
    public void trigger() {
        type = type.triggeredType();
    }

    public long id() {
        return id;
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
        return filled;
    }

    public long remaining() {
        return quantity - filled;
    }

    public long limitPrice() {
        return limitPrice;
    }

    public boolean hasLimitPrice() {
        return limitPrice != NO_PRICE;
    }

    public long stopPrice() {
        return stopPrice;
    }

    /**
     * Volume weighted average fill price in ticks, NaN before the first fill.
     */
    public double averageFillPriceTicks() {
        return filled == 0 ? Double.NaN : filledNotional / filled;
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
        return "Order{" +
                "id=" + id +
                ", " + side + " " + type +
                ", qty=" + quantity +
                ", filled=" + filled +
                ", limit=" + (limitPrice == NO_PRICE ? "-" : limitPrice) +
                ", stop=" + (stopPrice == NO_PRICE ? "-" : stopPrice) +
                ", status=" + status +
                ", owner=" + ownerId +
                '}';
    }
}
