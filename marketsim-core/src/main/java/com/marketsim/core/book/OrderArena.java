package com.marketsim.core.book;

import org.agrona.collections.Long2LongHashMap;

import java.util.Arrays;

/**
 * <h1>Order Arena: Slots Instead of References</h1>
 *
 * <p>
 * Every resting order occupies one numbered slot. Price levels link their FIFO
 * queues through the arena's {@code next}/{@code prev} slot arrays, so a level
 * never holds a reference to a live order and an order is never reachable from
 * two mutable collections at once.
 * </p>
 *
 * <h2>Layout</h2>
 * <ul>
 * <li><b>orders[]</b> the order in each slot, null when free.</li>
 * <li><b>next[] / prev[]</b> intrusive doubly linked list, {@link #NIL} terminated.</li>
 * <li><b>slotById</b> an Agrona {@link Long2LongHashMap} from order id to slot,
 * unboxed so lookups on cancel do not allocate.</li>
 * <li><b>free[]</b> a stack of released slots, reused before the arena grows.</li>
 * </ul>
 *
 * <p>
 * Capacity doubles when full. Like the book that owns it, the arena has a single
 * writer and no locking.
 * </p>
 */
public class OrderArena {

    public static final int NIL = -1;

    private Order[] orders;
    private int[] next;
    private int[] prev;
    private int[] free;
    private int freeTop;
    private int highWater;
    private int size;
    private final Long2LongHashMap slotById = new Long2LongHashMap(NIL);

    public OrderArena(int initialCapacity) {
        int capacity = Math.max(16, initialCapacity);
        this.orders = new Order[capacity];
        this.next = new int[capacity];
        this.prev = new int[capacity];
        this.free = new int[capacity];
    }

    /**
     * Places the order in a slot and returns it. The slot starts unlinked.
     */
    public int allocate(Order order) {
        if (slotById.get(order.id()) != NIL) {
            throw new IllegalStateException("order " + order.id() + " already has a slot");
        }
        int slot;
        if (freeTop > 0) {
            slot = free[--freeTop];
        } else {
            if (highWater == orders.length) {
                grow();
            }
            slot = highWater++;
        }
        orders[slot] = order;
        next[slot] = NIL;
        prev[slot] = NIL;
        slotById.put(order.id(), slot);
        size++;
        return slot;
    }

    public void release(int slot) {
        Order order = orders[slot];
        if (order == null) {
            return;
        }
        slotById.remove(order.id());
        orders[slot] = null;
        next[slot] = NIL;
        prev[slot] = NIL;
        free[freeTop++] = slot;
        size--;
    }

    private void grow() {
        int capacity = orders.length * 2;
        orders = Arrays.copyOf(orders, capacity);
        next = Arrays.copyOf(next, capacity);
        prev = Arrays.copyOf(prev, capacity);
        free = Arrays.copyOf(free, capacity);
    }

    public Order get(int slot) {
        return orders[slot];
    }

    /**
     * @return the slot holding {@code orderId}, or {@link #NIL}
     */
    public int slotOf(long orderId) {
        return (int) slotById.get(orderId);
    }

    public int next(int slot) {
        return next[slot];
    }

    public int prev(int slot) {
        return prev[slot];
    }

    void link(int slot, int prevSlot, int nextSlot) {
        prev[slot] = prevSlot;
        next[slot] = nextSlot;
    }

    void setNext(int slot, int nextSlot) {
        next[slot] = nextSlot;
    }

    void setPrev(int slot, int prevSlot) {
        prev[slot] = prevSlot;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return orders.length;
    }
}
