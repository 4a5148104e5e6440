package com.marketsim.core.execution;

import com.marketsim.core.book.Order;
import org.agrona.collections.Long2ObjectHashMap;

/**
 * Orders that no longer rest anywhere, kept so their final state can still be
 * queried. Holds at most {@code capacity} orders; the oldest entry goes first.
 */
public class OrderHistory {

    private final Long2ObjectHashMap<Order> orders = new Long2ObjectHashMap<>();
    private final long[] ring;
    private int next;
    private int size;

    public OrderHistory(int capacity) {
        this.ring = new long[capacity];
    }

    public void add(Order order) {
        if (orders.containsKey(order.id())) {
            return;
        }
        if (size == ring.length) {
            orders.remove(ring[next]);
        } else {
            size++;
        }
        ring[next] = order.id();
        next = (next + 1) % ring.length;
        orders.put(order.id(), order);
    }

    public Order get(long orderId) {
        return orders.get(orderId);
    }

    public int size() {
        return size;
    }
}
