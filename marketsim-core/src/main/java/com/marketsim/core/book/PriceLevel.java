package com.marketsim.core.book;

/**
 * <b>The Price Level: A "Fat" Node</b>
 * <p>
 * All resting orders at one price on one side, in arrival order.
 * </p>
 *
 * <h3>Intrusive Queue &amp; Tree Node</h3>
 * <p>
 * The queue is a doubly linked list of {@link OrderArena} slots: {@code head}
 * is the oldest order and matches first, new orders go to {@code tail}. The
 * level is also its own node in the {@link RedBlackTree} (left/right/parent).
 * </p>
 * <p>
 * {@code totalQuantity} is the sum of the remaining (unfilled) quantity of the
 * queued orders and must be kept in step on every fill.
 * </p>
 */
public class PriceLevel {
    public long price;

    // Queue (arena slots)
    public int head = OrderArena.NIL;
    public int tail = OrderArena.NIL;
    public long totalQuantity;
    public int orderCount;

    // Red-Black Tree pointers (Intrusive)
    public PriceLevel left;
    public PriceLevel right;
    public PriceLevel parent;
    public boolean color; // true = RED, false = BLACK

    public void reset() {
        price = 0;
        head = OrderArena.NIL;
        tail = OrderArena.NIL;
        totalQuantity = 0;
        orderCount = 0;

        left = null;
        right = null;
        parent = null;
        color = false;
    }

    public void append(OrderArena arena, int slot) {
        if (head == OrderArena.NIL) {
            head = slot;
            tail = slot;
            arena.link(slot, OrderArena.NIL, OrderArena.NIL);
        } else {
            arena.setNext(tail, slot);
            arena.link(slot, tail, OrderArena.NIL);
            tail = slot;
        }
        totalQuantity += arena.get(slot).remaining();
        orderCount++;
    }

    /**
     * Unlinks the slot. Assumes it is queued on this level.
     */
    public void remove(OrderArena arena, int slot) {
        int p = arena.prev(slot);
        int n = arena.next(slot);
        if (p != OrderArena.NIL) {
            arena.setNext(p, n);
        } else {
            head = n;
        }
        if (n != OrderArena.NIL) {
            arena.setPrev(n, p);
        } else {
            tail = p;
        }
        totalQuantity -= arena.get(slot).remaining();
        orderCount--;
        arena.link(slot, OrderArena.NIL, OrderArena.NIL);
    }

    /**
     * Called when a queued order is partially or fully filled in place.
     */
    public void reduce(long qty) {
        totalQuantity -= qty;
    }

    public boolean isEmpty() {
        return head == OrderArena.NIL;
    }

    @Override
    public String toString() {
        return "PriceLevel{" + price + " qty=" + totalQuantity + " orders=" + orderCount + '}';
    }
}
