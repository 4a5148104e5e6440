package com.marketsim.core;

import com.marketsim.api.AnalyticsSnapshot;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.Fill;
import com.marketsim.api.MarketState;
import com.marketsim.api.OrderReport;
import com.marketsim.api.OrderRequest;
import com.marketsim.core.agent.AgentContext;
import com.marketsim.core.agent.AgentPopulation;
import com.marketsim.core.analytics.AnalyticsEngine;
import com.marketsim.core.book.OrderBook;
import com.marketsim.core.book.PriceScale;
import com.marketsim.core.execution.ExecutionEngine;
import com.marketsim.core.execution.ExecutionListener;
import com.marketsim.core.market.LiquidityModel;
import com.marketsim.core.market.PriceDiscovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;

/**
 * <h1>Symbol Engine: One Instrument, One Writer</h1>
 *
 * <p>
 * Owns every component of a single symbol and advances them in a fixed order
 * each tick. It is a plain single-threaded state machine: the lane that owns
 * it feeds it ticks and external orders one at a time, so the state after N
 * inputs depends only on the inputs and the seed.
 * </p>
 *
 * <h2>Tick Order</h2>
 * <ol>
 * <li><b>Price discovery</b> steps the reference price, using the net taker
 * flow accumulated since the previous tick.</li>
 * <li><b>Liquidity</b> recovers one tick toward its base.</li>
 * <li><b>Agents</b> decide in id order; their orders go through the
 * execution engine, which matches them, consumes liquidity and runs any
 * stops the trades set off.</li>
 * <li><b>Analytics</b> recompute when their trigger fires.</li>
 * <li>An immutable {@link SymbolSnapshot} is published.</li>
 * </ol>
 *
 * <p>
 * External submits and cancels also republish the snapshot once applied.
 * </p>
 */
public class SymbolEngine implements ExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(SymbolEngine.class);

    private final String symbol;
    private final SimulationConfig config;
    private final PriceScale scale;
    private final OrderBook book;
    private final LiquidityModel liquidity;
    private final PriceDiscovery discovery;
    private final ExecutionEngine execution;
    private final AgentPopulation agents;
    private final AnalyticsEngine analytics;
    private final ExecutionListener downstream;

    private long tick;
    private volatile SymbolSnapshot snapshot;

    /**
     * @param laneIndex  position of the symbol's lane, folded into the high bits
     *                   of its order and fill ids
     * @param downstream receives every fill and order event after the engine
     *                   has processed it
     */
    public SymbolEngine(String symbol, double initialPrice, int laneIndex, SimulationConfig config,
            ExecutionListener downstream) {
        this(symbol, initialPrice, laneIndex, config, AgentPopulation.create(symbol, config), downstream);
    }

    public SymbolEngine(String symbol, double initialPrice, int laneIndex, SimulationConfig config,
            AgentPopulation agents, ExecutionListener downstream) {
        this.symbol = symbol;
        this.config = config;
        this.scale = new PriceScale(config.tickSize());
        this.book = new OrderBook(symbol, scale);
        this.liquidity = new LiquidityModel(config);
        this.discovery = new PriceDiscovery(config, initialPrice, liquidity,
                new Random(Seeds.derive(config.seed(), symbol, 0)));
        this.execution = new ExecutionEngine(symbol, config, book, liquidity, idBase(laneIndex), this);
        this.agents = agents;
        this.analytics = new AnalyticsEngine(symbol, config);
        this.downstream = downstream == null ? ExecutionListener.NO_OP : downstream;
        this.snapshot = capture();
        log.info("{} engine ready at {} with {} agents", symbol, initialPrice, agents.size());
    }

    public static long idBase(int laneIndex) {
        return ((long) (laneIndex + 1)) << 40;
    }

    /**
     * Runs one simulation tick.
     *
     * @throws InvariantViolationException when the book is found inconsistent
     */
    public SymbolSnapshot tick() {
        tick++;
        long now = now();

        discovery.step(execution.drainNetFlow(), book.midPrice());
        liquidity.decayTowardBase(1);

        BookSnapshot before = book.snapshot(config.maxBookDepth(), execution.lastTradePrice(), now, tick);
        AgentContext context = new AgentContext(symbol, tick, now, before, marketState(now),
                discovery.previewNextMove(), scale.tickSize());
        agents.runTick(context, execution);

        book.verifyInvariants();
        BookSnapshot after = book.snapshot(config.maxBookDepth(), execution.lastTradePrice(), now, tick);
        AnalyticsSnapshot stats = analytics.endOfTick(after, discovery.price(), tick);
        snapshot = new SymbolSnapshot(after, marketState(now), stats);
        return snapshot;
    }

    public long submit(OrderRequest request) {
        long id = execution.submit(request, now());
        snapshot = capture();
        return id;
    }

    public boolean cancel(long orderId) {
        boolean cancelled = execution.cancel(orderId);
        if (cancelled) {
            snapshot = capture();
        }
        return cancelled;
    }

    public OrderReport getOrder(long orderId) {
        return execution.getOrder(orderId);
    }

    public List<Fill> recentFills(int limit) {
        return execution.recentFills(limit);
    }

    private SymbolSnapshot capture() {
        long now = now();
        BookSnapshot books = book.snapshot(config.maxBookDepth(), execution.lastTradePrice(), now, tick);
        return new SymbolSnapshot(books, marketState(now), analytics.current());
    }

    private MarketState marketState(long now) {
        return new MarketState(symbol, discovery.price(), discovery.realizedVolatility(), discovery.momentum(),
                liquidity.level(), execution.volume(), execution.lastTradePrice(), tick, now);
    }

    /**
     * Simulated time in nanos.
     */
    public long now() {
        return tick * config.tickIntervalNanos();
    }

    @Override
    public void onFill(Fill fill) {
        agents.onFill(fill);
        analytics.onFill(fill);
        downstream.onFill(fill);
    }

    @Override
    public void onOrderAccepted(OrderReport order) {
        downstream.onOrderAccepted(order);
    }

    @Override
    public void onOrderRejected(OrderReport order, String reason) {
        downstream.onOrderRejected(order, reason);
    }

    @Override
    public void onOrderCancelled(OrderReport order) {
        downstream.onOrderCancelled(order);
    }

    public String symbol() {
        return symbol;
    }

    public long currentTick() {
        return tick;
    }

    /**
     * Last published snapshot; safe to call from any thread.
     */
    public SymbolSnapshot snapshot() {
        return snapshot;
    }

    public OrderBook book() {
        return book;
    }

    public ExecutionEngine execution() {
        return execution;
    }

    public AgentPopulation agents() {
        return agents;
    }

    public LiquidityModel liquidity() {
        return liquidity;
    }

    public PriceDiscovery discovery() {
        return discovery;
    }

    /**
     * State of the book for a halt report.
     */
    public String dump() {
        return book.dump();
    }
}
