package com.marketsim.core.execution;

import com.marketsim.api.Side;
import com.marketsim.core.book.Order;
import org.agrona.collections.Long2ObjectHashMap;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Untriggered STOP and STOP_LIMIT orders, keyed by stop price in ticks.
 * <p>
 * A buy stop fires once the last trade is at or above its stop, a sell stop
 * once it is at or below. Orders that fire together come out in the order the
 * price move crossed their stops, then by arrival.
 * </p>
 */
public class StopOrderBook {

    private final TreeMap<Long, List<Order>> buyStops = new TreeMap<>();
    private final TreeMap<Long, List<Order>> sellStops = new TreeMap<>();
    private final Long2ObjectHashMap<Order> byId = new Long2ObjectHashMap<>();

    public static boolean isTriggered(Order order, long lastTradeTicks) {
        return order.side() == Side.BUY ? lastTradeTicks >= order.stopPrice() : lastTradeTicks <= order.stopPrice();
    }

    public void add(Order order) {
        TreeMap<Long, List<Order>> side = order.side() == Side.BUY ? buyStops : sellStops;
        side.computeIfAbsent(order.stopPrice(), k -> new ArrayList<>()).add(order);
        byId.put(order.id(), order);
    }

    /**
     * @return the removed order, or null when no such stop is held
     */
    public Order remove(long orderId) {
        Order order = byId.remove(orderId);
        if (order == null) {
            return null;
        }
        TreeMap<Long, List<Order>> side = order.side() == Side.BUY ? buyStops : sellStops;
        List<Order> atPrice = side.get(order.stopPrice());
        atPrice.remove(order);
        if (atPrice.isEmpty()) {
            side.remove(order.stopPrice());
        }
        return order;
    }

    /**
     * Removes and returns every stop the given last trade price sets off.
     */
    public List<Order> drainTriggered(long lastTradeTicks) {
        List<Order> fired = new ArrayList<>();
        // Buy stops at or below the last trade, lowest first
        drain(buyStops.headMap(lastTradeTicks, true), fired);
        // Sell stops at or above the last trade, highest first
        drain(sellStops.tailMap(lastTradeTicks, true).descendingMap(), fired);
        return fired;
    }

    private void drain(NavigableMap<Long, List<Order>> range, List<Order> fired) {
        Iterator<Map.Entry<Long, List<Order>>> it = range.entrySet().iterator();
        while (it.hasNext()) {
            for (Order order : it.next().getValue()) {
                byId.remove(order.id());
                fired.add(order);
            }
            it.remove();
        }
    }

    public Order get(long orderId) {
        return byId.get(orderId);
    }

    public int size() {
        return byId.size();
    }
}
