package com.marketsim.core.book;

import com.marketsim.api.BookLevel;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.OrderStatus;
import com.marketsim.api.OrderType;
import com.marketsim.api.OrderValidationException;
import com.marketsim.api.Side;
import com.marketsim.core.InvariantViolationException;
import org.agrona.collections.Long2ObjectHashMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * <h1>The Order Book: One Symbol's Resting Liquidity</h1>
 *
 * <p>
 * A limit order book with price-time priority. It owns every resting order of
 * one symbol and is the only place where they are matched.
 * </p>
 *
 * <h2>Hybrid Data Structure</h2>
 *
 * <table border="1">
 * <tr>
 * <th>Component</th>
 * <th>Technology</th>
 * <th>Purpose (Time Complexity)</th>
 * </tr>
 * <tr>
 * <td><b>Lookup</b></td>
 * <td>{@link org.agrona.collections.Long2ObjectHashMap}</td>
 * <td><b>O(1)</b> access to a price level on insert and cancel.</td>
 * </tr>
 * <tr>
 * <td><b>Ordering</b></td>
 * <td>{@link RedBlackTree} (Intrusive)</td>
 * <td><b>O(log N)</b> best price and next-best price while sweeping.</td>
 * </tr>
 * <tr>
 * <td><b>Queue</b></td>
 * <td>{@link OrderArena} slots</td>
 * <td><b>O(1)</b> FIFO append and unlink within a level.</td>
 * </tr>
 * </table>
 *
 * <h2>Single Writer</h2>
 * <p>
 * Not thread-safe. Only the lane that owns the symbol calls into the book;
 * everybody else reads the {@link BookSnapshot}s it produces.
 * </p>
 *
 * <h2>Invariants</h2>
 * <ul>
 * <li>Bids strictly descending, asks strictly ascending (one level per price).</li>
 * <li>A present level is never empty, its total equals the sum of its orders'
 * remaining quantity.</li>
 * <li>After a matching pass the book is not crossed: best bid &lt; best ask.</li>
 * </ul>
 * {@link #verifyInvariants()} checks all of them.
 */
public class OrderBook {

    private final String symbol;
    private final PriceScale scale;
    private final OrderArena arena;

    private final Long2ObjectHashMap<PriceLevel> bids = new Long2ObjectHashMap<>();
    private final Long2ObjectHashMap<PriceLevel> asks = new Long2ObjectHashMap<>();

    private final RedBlackTree bidTree = new RedBlackTree();
    private final RedBlackTree askTree = new RedBlackTree();

    // Recycled levels
    private final ArrayDeque<PriceLevel> spareLevels = new ArrayDeque<>();

    public OrderBook(String symbol, PriceScale scale, int initialCapacity) {
        this.symbol = symbol;
        this.scale = scale;
        this.arena = new OrderArena(initialCapacity);
    }

    public OrderBook(String symbol, PriceScale scale) {
        this(symbol, scale, 1024);
    }

    /**
     * Rests a limit order at the tail of its price level.
     * <p>
     * A PENDING order becomes OPEN; a PARTIALLY_FILLED remainder keeps its status.
     * </p>
     *
     * @throws OrderValidationException when the order cannot rest: it is not a
     *                                  limit order, has no price or nothing left,
     *                                  is terminal, or is already in the book
     */
    public void add(Order order) {
        if (order.type() != OrderType.LIMIT || !order.hasLimitPrice()) {
            throw new OrderValidationException("only priced limit orders can rest, got " + order);
        }
        if (order.limitPrice() <= 0) {
            throw new OrderValidationException("limit price must be positive: " + order);
        }
        if (order.remaining() <= 0) {
            throw new OrderValidationException("nothing left to rest: " + order);
        }
        if (order.status().isTerminal()) {
            throw new OrderValidationException("terminal order cannot rest: " + order);
        }
        if (arena.slotOf(order.id()) != OrderArena.NIL) {
            throw new OrderValidationException("order already resting: " + order.id());
        }
        if (order.status() == OrderStatus.PENDING) {
            order.transitionTo(OrderStatus.OPEN);
        }

        Long2ObjectHashMap<PriceLevel> sideMap = order.side() == Side.BUY ? bids : asks;
        RedBlackTree sideTree = order.side() == Side.BUY ? bidTree : askTree;

        PriceLevel level = sideMap.get(order.limitPrice());
        if (level == null) {
            level = borrowLevel(order.limitPrice());
            sideMap.put(level.price, level);
            sideTree.insert(level);
        }
        level.append(arena, arena.allocate(order));
    }

    /**
     * Takes a resting order out of the book, dropping its level when it was the
     * last one there. Status is left to the caller.
     *
     * @return the order, or null when it is not resting
     */
    public Order remove(long orderId) {
        int slot = arena.slotOf(orderId);
        if (slot == OrderArena.NIL) {
            return null;
        }
        Order order = arena.get(slot);
        Long2ObjectHashMap<PriceLevel> sideMap = order.side() == Side.BUY ? bids : asks;
        RedBlackTree sideTree = order.side() == Side.BUY ? bidTree : askTree;

        PriceLevel level = sideMap.get(order.limitPrice());
        level.remove(arena, slot);
        arena.release(slot);
        if (level.isEmpty()) {
            dropLevel(level, sideMap, sideTree);
        }
        return order;
    }

    /**
     * Matches {@code incoming} against the opposite side.
     * <p>
     * <b>Algorithm:</b>
     * <ol>
     * <li>Take the best contra level (lowest ask for a buy, highest bid for a sell).</li>
     * <li>Stop if it is beyond the limit (limit orders only; market orders take any price).</li>
     * <li>Fill against the level's queue head first. Both orders get the same
     * quantity at the level's price. A fully filled maker leaves the book, a
     * partially filled one stays at the front.</li>
     * <li>Repeat until the incoming order is done or the side is exhausted.</li>
     * </ol>
     * The incoming order is not rested here; its remainder is the caller's call.
     * </p>
     */
    public MatchResult match(Order incoming, TradeListener listener) {
        long filledBefore = incoming.filledQuantity();
        boolean buy = incoming.side() == Side.BUY;
        boolean priced = incoming.type() == OrderType.LIMIT;
        long limit = incoming.limitPrice();

        Long2ObjectHashMap<PriceLevel> contraMap = buy ? asks : bids;
        RedBlackTree contraTree = buy ? askTree : bidTree;

        int trades = 0;
        long lastPrice = Order.NO_PRICE;
        while (incoming.remaining() > 0) {
            PriceLevel best = buy ? contraTree.min() : contraTree.max();
            if (best == null) {
                break;
            }
            if (priced && (buy ? best.price > limit : best.price < limit)) {
                break;
            }
            lastPrice = best.price;
            trades += matchLevel(best, incoming, contraMap, contraTree, listener);
        }

        return new MatchResult(incoming.filledQuantity() - filledBefore, trades, lastPrice);
    }

    private int matchLevel(PriceLevel level, Order incoming, Long2ObjectHashMap<PriceLevel> map, RedBlackTree tree,
            TradeListener listener) {
        int trades = 0;
        long price = level.price;
        int slot = level.head;
        while (slot != OrderArena.NIL && incoming.remaining() > 0) {
            Order maker = arena.get(slot);
            long qty = Math.min(incoming.remaining(), maker.remaining());

            maker.recordFill(qty, price);
            incoming.recordFill(qty, price);
            level.reduce(qty);

            int next = arena.next(slot);
            if (maker.remaining() == 0) {
                level.remove(arena, slot);
                arena.release(slot);
            }
            trades++;
            listener.onTrade(maker, incoming, price, qty);
            slot = next;
        }

        if (level.isEmpty()) {
            dropLevel(level, map, tree);
        }
        return trades;
    }

    private PriceLevel borrowLevel(long price) {
        PriceLevel level = spareLevels.poll();
        if (level == null) {
            level = new PriceLevel();
        }
        level.reset();
        level.price = price;
        return level;
    }

    private void dropLevel(PriceLevel level, Long2ObjectHashMap<PriceLevel> map, RedBlackTree tree) {
        map.remove(level.price);
        tree.remove(level);
        level.reset();
        spareLevels.push(level);
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public String symbol() {
        return symbol;
    }

    public PriceScale scale() {
        return scale;
    }

    public PriceLevel bestBid() {
        return bidTree.max();
    }

    public PriceLevel bestAsk() {
        return askTree.min();
    }

    /**
     * Best level on the side an order of {@code side} would trade against.
     */
    public PriceLevel bestContra(Side side) {
        return side == Side.BUY ? bestAsk() : bestBid();
    }

    /**
     * Mid in ticks, NaN unless both sides have liquidity.
     */
    public double midTicks() {
        PriceLevel bid = bestBid();
        PriceLevel ask = bestAsk();
        return bid == null || ask == null ? Double.NaN : (bid.price + ask.price) / 2.0;
    }

    public double midPrice() {
        return scale.toPrice(midTicks());
    }

    public boolean isEmpty(Side side) {
        return side == Side.BUY ? bidTree.isEmpty() : askTree.isEmpty();
    }

    public int levelCount(Side side) {
        return side == Side.BUY ? bidTree.size() : askTree.size();
    }

    /**
     * Resting quantity at an exact price, 0 when the level does not exist.
     */
    public long quantityAt(Side side, long priceTicks) {
        PriceLevel level = (side == Side.BUY ? bids : asks).get(priceTicks);
        return level == null ? 0 : level.totalQuantity;
    }

    public long totalQuantity(Side side) {
        long[] total = new long[1];
        (side == Side.BUY ? bidTree : askTree).forEach(side == Side.SELL, Integer.MAX_VALUE,
                level -> total[0] += level.totalQuantity);
        return total[0];
    }

    /**
     * @return the resting order, or null
     */
    public Order getOrder(long orderId) {
        int slot = arena.slotOf(orderId);
        return slot == OrderArena.NIL ? null : arena.get(slot);
    }

    public boolean contains(long orderId) {
        return arena.slotOf(orderId) != OrderArena.NIL;
    }

    public int restingOrderCount() {
        return arena.size();
    }

    /**
     * Resting orders at one level in queue order. For inspection and tests.
     */
    public List<Order> ordersAt(Side side, long priceTicks) {
        List<Order> out = new ArrayList<>();
        PriceLevel level = (side == Side.BUY ? bids : asks).get(priceTicks);
        if (level != null) {
            for (int slot = level.head; slot != OrderArena.NIL; slot = arena.next(slot)) {
                out.add(arena.get(slot));
            }
        }
        return out;
    }

    public BookSnapshot snapshot(int depth, double lastTradePrice, long timestamp, long tick) {
        List<BookLevel> bidLevels = new ArrayList<>();
        List<BookLevel> askLevels = new ArrayList<>();
        bidTree.forEach(false, depth,
                level -> bidLevels.add(new BookLevel(scale.toPrice(level.price), level.totalQuantity, level.orderCount)));
        askTree.forEach(true, depth,
                level -> askLevels.add(new BookLevel(scale.toPrice(level.price), level.totalQuantity, level.orderCount)));
        return new BookSnapshot(symbol, bidLevels, askLevels, lastTradePrice, timestamp, tick);
    }

    // =========================================================================
    // Consistency
    // =========================================================================

    /**
     * @throws InvariantViolationException with a dump of the book when any
     *                                     structural invariant is broken
     */
    public void verifyInvariants() {
        verifySide(Side.BUY, bids, bidTree);
        verifySide(Side.SELL, asks, askTree);
        PriceLevel bid = bestBid();
        PriceLevel ask = bestAsk();
        if (bid != null && ask != null && bid.price >= ask.price) {
            fail("crossed book: bid " + bid.price + " >= ask " + ask.price);
        }
        int counted = 0;
        for (PriceLevel level : bids.values()) {
            counted += level.orderCount;
        }
        for (PriceLevel level : asks.values()) {
            counted += level.orderCount;
        }
        if (counted != arena.size()) {
            fail("arena holds " + arena.size() + " orders but levels count " + counted);
        }
    }

    private void verifySide(Side side, Long2ObjectHashMap<PriceLevel> map, RedBlackTree tree) {
        if (map.size() != tree.size()) {
            fail(side + " map has " + map.size() + " levels, tree has " + tree.size());
        }
        boolean descending = side == Side.BUY;
        PriceLevel previous = null;
        PriceLevel level = descending ? tree.max() : tree.min();
        while (level != null) {
            if (map.get(level.price) != level) {
                fail(side + " level " + level.price + " is in the tree but not the map");
            }
            if (previous != null && (descending ? level.price >= previous.price : level.price <= previous.price)) {
                fail(side + " levels out of order: " + previous.price + " then " + level.price);
            }
            if (level.isEmpty() || level.totalQuantity <= 0) {
                fail(side + " level " + level.price + " is present but empty (qty " + level.totalQuantity + ")");
            }
            long sum = 0;
            int count = 0;
            for (int slot = level.head; slot != OrderArena.NIL; slot = arena.next(slot)) {
                Order order = arena.get(slot);
                if (order.side() != side || order.limitPrice() != level.price) {
                    fail("order " + order.id() + " queued on wrong level " + side + "@" + level.price);
                }
                if (order.remaining() <= 0 || order.filledQuantity() < 0) {
                    fail("order " + order.id() + " resting with remaining " + order.remaining());
                }
                sum += order.remaining();
                count++;
            }
            if (sum != level.totalQuantity || count != level.orderCount) {
                fail(side + " level " + level.price + " total " + level.totalQuantity + "/" + level.orderCount
                        + " but orders sum to " + sum + "/" + count);
            }
            previous = level;
            level = descending ? tree.predecessor(level) : tree.successor(level);
        }
    }

    private void fail(String message) {
        throw new InvariantViolationException(symbol + ": " + message, dump());
    }

    /**
     * Human readable state of the whole book.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append("OrderBook[").append(symbol).append("] resting=").append(arena.size()).append('\n');
        sb.append("  ASKS (high to low)\n");
        List<PriceLevel> askLevels = new ArrayList<>();
        askTree.forEach(true, Integer.MAX_VALUE, askLevels::add);
        for (int i = askLevels.size() - 1; i >= 0; i--) {
            appendLevel(sb, askLevels.get(i));
        }
        sb.append("  BIDS (high to low)\n");
        bidTree.forEach(false, Integer.MAX_VALUE, level -> appendLevel(sb, level));
        return sb.toString();
    }

    private void appendLevel(StringBuilder sb, PriceLevel level) {
        sb.append("    ").append(level.price).append(" qty=").append(level.totalQuantity).append(" [");
        for (int slot = level.head; slot != OrderArena.NIL; slot = arena.next(slot)) {
            Order order = arena.get(slot);
            sb.append(order.id()).append(':').append(order.remaining());
            if (arena.next(slot) != OrderArena.NIL) {
                sb.append(", ");
            }
        }
        sb.append("]\n");
    }

    public static class MatchResult {
        public final long filledQty;
        public final int trades;
        /** Price of the last level traded, {@link Order#NO_PRICE} when nothing traded. */
        public final long lastPrice;

        public MatchResult(long filledQty, int trades, long lastPrice) {
            this.filledQty = filledQty;
            this.trades = trades;
            this.lastPrice = lastPrice;
        }
    }
}
