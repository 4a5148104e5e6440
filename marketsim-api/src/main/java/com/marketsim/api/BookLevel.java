package com.marketsim.api;

public final class BookLevel {

    private final double price;
    private final long quantity;
    private final int orderCount;

    public BookLevel(double price, long quantity, int orderCount) {
        this.price = price;
        this.quantity = quantity;
        this.orderCount = orderCount;
    }

    public double price() {
        return price;
    }

    public long quantity() {
        return quantity;
    }

    public int orderCount() {
        return orderCount;
    }

    @Override
    public String toString() {
        return quantity + "@" + price + "(" + orderCount + ")";
    }
}
