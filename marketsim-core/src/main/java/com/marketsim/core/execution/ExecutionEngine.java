package com.marketsim.core.execution;

import com.marketsim.api.Fill;
import com.marketsim.api.LiquidityRole;
import com.marketsim.api.OrderReport;
import com.marketsim.api.OrderRequest;
import com.marketsim.api.OrderStatus;
import com.marketsim.api.OrderType;
import com.marketsim.api.OrderValidationException;
import com.marketsim.api.Side;
import com.marketsim.core.SimulationConfig;
import com.marketsim.core.book.Order;
import com.marketsim.core.book.OrderBook;
import com.marketsim.core.book.PriceLevel;
import com.marketsim.core.book.PriceScale;
import com.marketsim.core.book.TradeListener;
import com.marketsim.core.market.LiquidityModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * <h1>The Execution Engine: One Door Into the Book</h1>
 *
 * <p>
 * Every order for a symbol, from an external caller or a simulated agent, comes
 * through {@link #submit}. The engine builds the {@link Order}, routes it, and
 * turns each trade the book reports into a pair of {@link Fill}s.
 * </p>
 *
 * <h2>Routing</h2>
 * <ul>
 * <li><b>MARKET</b>: rejected outright when the contra side is empty.
 * Otherwise matched at any price; an unfilled remainder is handled by the
 * {@link MarketRemainderPolicy}. Never rests.</li>
 * <li><b>LIMIT</b>: matched while marketable, the remainder rests.</li>
 * <li><b>STOP / STOP_LIMIT</b>: held in the {@link StopOrderBook} until the last
 * trade crosses the stop, then run as MARKET / LIMIT. Stops set off by a trade
 * are run right after the matching pass that printed it, so cascades resolve
 * inside the same submit.</li>
 * </ul>
 *
 * <h2>Execution Cost</h2>
 * <p>
 * The book price is what the maker gets. The taker's recorded execution price
 * moves against it by the {@link SlippageModel} fraction for the order's size,
 * plus square-root impact on the part of the order larger than the visible top
 * level. Fill timestamps are the submit time plus the configured latency; the
 * engine never actually waits.
 * </p>
 *
 * <p>
 * Single threaded: it belongs to one symbol lane.
 * </p>
 */
public class ExecutionEngine implements TradeListener {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final String symbol;
    private final OrderBook book;
    private final PriceScale scale;
    private final LiquidityModel liquidity;
    private final ExecutionListener listener;

    private final SlippageModel slippageModel;
    private final double slippageCoefficient;
    private final long latencyNanos;
    private final MarketRemainderPolicy remainderPolicy;

    private final StopOrderBook stops = new StopOrderBook();
    private final OrderHistory history;
    private final FillLedger ledger;

    private final long idBase;
    private long orderSequence;
    private long fillSequence;

    private long now;
    private long netFlow;
    private long volume;
    private long tradeCount;
    private long lastTradeTicks = Order.NO_PRICE;

    // Per matching pass
    private double passMidTicks;
    private double passCostFraction;

    /**
     * @param idBase high bits OR-ed into every order and fill id, so ids from
     *               different symbols never collide
     */
    public ExecutionEngine(String symbol, SimulationConfig config, OrderBook book, LiquidityModel liquidity,
            long idBase, ExecutionListener listener) {
        this.symbol = symbol;
        this.book = book;
        this.scale = book.scale();
        this.liquidity = liquidity;
        this.listener = listener;
        this.slippageModel = config.slippageModel();
        this.slippageCoefficient = config.slippageCoefficient();
        this.latencyNanos = config.latencyNanos();
        this.remainderPolicy = config.marketRemainderPolicy();
        this.history = new OrderHistory(config.orderHistoryCapacity());
        this.ledger = new FillLedger(config.fillLedgerCapacity());
        this.idBase = idBase;
    }

    /**
     * Accepts and processes an order at simulated time {@code timestamp}.
     *
     * @return the assigned order id, whatever the outcome
     * @throws OrderValidationException for another symbol's order or a price
     *                                  that rounds to zero ticks or lies above
     *                                  {@link PriceScale#MAX_TICKS}
     */
    public long submit(OrderRequest request, long timestamp) {
        if (!symbol.equals(request.symbol())) {
            throw new OrderValidationException("order for " + request.symbol() + " sent to " + symbol);
        }
        long limit = request.type().requiresLimitPrice() ? toTicks(request.limitPrice()) : Order.NO_PRICE;
        long stop = request.type().requiresStopPrice() ? toTicks(request.stopPrice()) : Order.NO_PRICE;

        now = timestamp;
        Order order = new Order(idBase | ++orderSequence, symbol, request.side(), request.type(), request.quantity(),
                limit, stop, timestamp, request.ownerId());
        log.debug("{} submit {}", symbol, order);

        if (order.type().requiresStopPrice()) {
            order.transitionTo(OrderStatus.OPEN);
            if (lastTradeTicks != Order.NO_PRICE && StopOrderBook.isTriggered(order, lastTradeTicks)) {
                order.trigger();
                execute(order);
            } else {
                stops.add(order);
                listener.onOrderAccepted(report(order));
            }
        } else {
            execute(order);
        }
        runTriggeredStops();
        book.verifyInvariants();
        return order.id();
    }

    private long toTicks(double price) {
        long ticks = scale.toTicks(price);
        if (ticks <= 0) {
            throw new OrderValidationException("price " + price + " is below one tick (" + scale.tickSize() + ")");
        }
        if (ticks > PriceScale.MAX_TICKS) {
            throw new OrderValidationException("price " + price + " is above the largest price this book can hold");
        }
        return ticks;
    }

    private void execute(Order order) {
        if (order.type() == OrderType.MARKET) {
            executeMarket(order);
        } else {
            executeLimit(order);
        }
    }

    private void executeMarket(Order order) {
        if (book.isEmpty(order.side().opposite())) {
            String reason = "no " + (order.side() == Side.BUY ? "ask" : "bid") + " liquidity";
            // A triggered stop is already live, so it can only be cancelled
            order.transitionTo(order.status() == OrderStatus.PENDING ? OrderStatus.REJECTED : OrderStatus.CANCELLED);
            history.add(order);
            log.warn("{} market order {} {} {}: {}", symbol, order.id(), order.side(), order.status(), reason);
            listener.onOrderRejected(report(order), reason);
            return;
        }
        if (order.status() == OrderStatus.PENDING) {
            order.transitionTo(OrderStatus.OPEN);
        }
        matchIncoming(order);

        if (order.remaining() > 0) {
            log.debug("{} market order {} left {} unfilled ({})", symbol, order.id(), order.remaining(),
                    remainderPolicy);
            if (remainderPolicy == MarketRemainderPolicy.CANCEL) {
                order.transitionTo(OrderStatus.CANCELLED);
                listener.onOrderCancelled(report(order));
            }
        }
        history.add(order);
    }

    private void executeLimit(Order order) {
        if (order.status() == OrderStatus.PENDING) {
            order.transitionTo(OrderStatus.OPEN);
        }
        matchIncoming(order);
        if (order.remaining() > 0) {
            book.add(order);
            listener.onOrderAccepted(report(order));
        } else {
            history.add(order);
        }
    }

    private void matchIncoming(Order order) {
        PriceLevel top = book.bestContra(order.side());
        long topDepth = top == null ? 0 : top.totalQuantity;
        long beyondTop = Math.max(0, order.remaining() - topDepth);

        passMidTicks = book.midTicks();
        passCostFraction = slippageModel.fraction(order.remaining(), liquidity.level(), slippageCoefficient)
                + Math.abs(liquidity.impact(order.side(), beyondTop));

        OrderBook.MatchResult result = book.match(order, this);
        if (result.trades > 0) {
            log.debug("{} order {} took {} in {} trades, last {}", symbol, order.id(), result.filledQty,
                    result.trades, result.lastPrice);
        }
    }

    @Override
    public void onTrade(Order maker, Order taker, long priceTicks, long quantity) {
        long timestamp = now + latencyNanos;
        double price = scale.toPrice(priceTicks);
        double mid = scale.toPrice(passMidTicks);
        double executionPrice = Math.max(price * (1.0 + taker.side().sign() * passCostFraction), scale.tickSize());

        Fill makerFill = new Fill(idBase | ++fillSequence, maker.id(), symbol, maker.side(), quantity, price, price,
                timestamp, LiquidityRole.MAKER, maker.ownerId(), mid);
        Fill takerFill = new Fill(idBase | ++fillSequence, taker.id(), symbol, taker.side(), quantity, price,
                executionPrice, timestamp, LiquidityRole.TAKER, taker.ownerId(), mid);

        liquidity.applyConsumption(quantity);
        netFlow += taker.side().sign() * quantity;
        volume += quantity;
        tradeCount++;
        lastTradeTicks = priceTicks;

        if (maker.status() == OrderStatus.FILLED) {
            history.add(maker);
        }
        ledger.append(makerFill);
        ledger.append(takerFill);
        listener.onFill(makerFill);
        listener.onFill(takerFill);
    }

    private void runTriggeredStops() {
        while (lastTradeTicks != Order.NO_PRICE && stops.size() > 0) {
            List<Order> fired = stops.drainTriggered(lastTradeTicks);
            if (fired.isEmpty()) {
                return;
            }
            for (Order order : fired) {
                log.debug("{} stop {} triggered at {}", symbol, order.id(), lastTradeTicks);
                order.trigger();
                execute(order);
            }
        }
    }

    /**
     * Cancels a resting limit order, a held stop, or a market order whose
     * remainder was left unfilled.
     *
     * @return false when the order is unknown or no longer live; nothing changes then
     */
    public boolean cancel(long orderId) {
        Order order = book.remove(orderId);
        if (order == null) {
            order = stops.remove(orderId);
        }
        if (order == null) {
            Order unfilled = history.get(orderId);
            if (unfilled == null || unfilled.status().isTerminal()) {
                return false;
            }
            order = unfilled;
        }
        order.transitionTo(OrderStatus.CANCELLED);
        history.add(order);
        log.debug("{} cancelled {}", symbol, order);
        listener.onOrderCancelled(report(order));
        book.verifyInvariants();
        return true;
    }

    /**
     * @return the order's current state, or null when it was never seen or
     *         has been evicted from history
     */
    public OrderReport getOrder(long orderId) {
        Order order = book.getOrder(orderId);
        if (order == null) {
            order = stops.get(orderId);
        }
        if (order == null) {
            order = history.get(orderId);
        }
        return order == null ? null : report(order);
    }

    public OrderReport report(Order order) {
        return new OrderReport(order.id(), order.symbol(), order.side(), order.type(), order.quantity(),
                order.filledQuantity(),
                order.hasLimitPrice() ? scale.toPrice(order.limitPrice()) : Double.NaN,
                order.stopPrice() != Order.NO_PRICE ? scale.toPrice(order.stopPrice()) : Double.NaN,
                scale.toPrice(order.averageFillPriceTicks()),
                order.status(), order.timestamp(), order.ownerId());
    }

    /**
     * Net taker flow since the last call (buys positive), then resets it.
     */
    public long drainNetFlow() {
        long flow = netFlow;
        netFlow = 0;
        return flow;
    }

    public long volume() {
        return volume;
    }

    public long tradeCount() {
        return tradeCount;
    }

    /**
     * NaN before the first trade.
     */
    public double lastTradePrice() {
        return lastTradeTicks == Order.NO_PRICE ? Double.NaN : scale.toPrice(lastTradeTicks);
    }

    public List<Fill> recentFills(int limit) {
        return ledger.recent(limit);
    }

    public FillLedger ledger() {
        return ledger;
    }

    public int pendingStopCount() {
        return stops.size();
    }

    public OrderBook book() {
        return book;
    }

    public String symbol() {
        return symbol;
    }
}
