package com.marketsim.infra;

import com.marketsim.api.AnalyticsSnapshot;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.ErrorCode;
import com.marketsim.api.Fill;
import com.marketsim.api.MarketState;
import com.marketsim.api.OrderReport;
import com.marketsim.api.OrderRequest;
import com.marketsim.api.Result;
import com.marketsim.core.SimulationConfig;
import com.marketsim.core.SymbolSnapshot;
import com.marketsim.core.execution.ExecutionListener;
import com.marketsim.infra.journal.Journal;
import org.agrona.concurrent.AgentRunner;
import org.agrona.concurrent.SleepingMillisIdleStrategy;
import org.agrona.concurrent.SystemNanoClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * <b>The Market Simulator.</b>
 * <p>
 * The <b>Composition Root</b> and the only public entry point. It wires:
 * <ul>
 * <li><b>Lanes:</b> one {@link SymbolLane} (Disruptor + single handler thread)
 * per symbol.</li>
 * <li><b>Clock:</b> a {@link SimulationClock} on an Agrona {@link AgentRunner},
 * ticking every lane once per interval.</li>
 * <li><b>Fills:</b> a {@link FillPublisher} feeding the {@link Journal} and any
 * extra {@link FillSink}s off the lane threads.</li>
 * </ul>
 *
 * <h3>System Topology:</h3>
 *
 * <pre>
 * [SimulationClock] --TICK--&gt; [Lane AAPL] [Lane MSFT] ... (tick barrier)
 * [Callers] --SUBMIT/CANCEL/QUERY--&gt; [Lane of the symbol]
 *                                        |
 *                                   (Fill Ring Buffer)
 *                                        |
 *                              [Journal] [Aeron egress]
 * </pre>
 *
 * <h3>Contract:</h3>
 * Every operation returns a {@link Result}; no failure crosses this boundary as
 * an exception. Reads of books, states and analytics come from the last
 * published snapshot and never wait on a lane.
 * </p>
 */
public class MarketSimulator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MarketSimulator.class);

    private final SimulationConfig config;
    private final Journal journal;
    private final FillPublisher fills;

    private final List<SymbolLane> lanes = new CopyOnWriteArrayList<>();
    private final Map<String, SymbolLane> lanesBySymbol = new ConcurrentHashMap<>();

    private SimulationClock clock;
    private AgentRunner clockRunner;
    private volatile boolean running;
    private volatile boolean closed;

    public MarketSimulator(SimulationConfig config) {
        this(config, Journal.NONE, List.of());
    }

    /**
     * @param journal receives every fill and lane halt
     * @param sinks   further fill consumers, called after the journal
     */
    public MarketSimulator(SimulationConfig config, Journal journal, List<FillSink> sinks) {
        this.config = config;
        this.journal = journal;
        List<FillSink> all = new ArrayList<>();
        all.add(journal::recordFill);
        all.addAll(sinks);
        this.fills = new FillPublisher(config.fillRingSize(), all);
    }

    public synchronized Result<Void> addSymbol(String symbol, double initialPrice) {
        if (closed) {
            return Result.error(ErrorCode.UNAVAILABLE, "simulator is closed");
        }
        if (symbol == null || symbol.isBlank()) {
            return Result.error(ErrorCode.VALIDATION_ERROR, "symbol must not be blank");
        }
        if (!(initialPrice > 0) || Double.isInfinite(initialPrice)) {
            return Result.error(ErrorCode.VALIDATION_ERROR, "initial price must be positive: " + initialPrice);
        }
        if (lanesBySymbol.containsKey(symbol)) {
            return Result.error(ErrorCode.ALREADY_EXISTS, symbol + " is already registered");
        }
        ExecutionListener publisher = fills::publish;
        SymbolLane lane = new SymbolLane(symbol, initialPrice, lanes.size(), config, publisher, journal);
        lane.start();
        lanes.add(lane);
        lanesBySymbol.put(symbol, lane);
        journal.recordEvent("symbol.added", lane.index());
        log.info("Added {} at {} on lane {}", symbol, initialPrice, lane.index());
        return Result.ok();
    }

    /**
     * Starts the wall-clock driven simulation.
     */
    public synchronized Result<Void> start() {
        if (closed) {
            return Result.error(ErrorCode.UNAVAILABLE, "simulator is closed");
        }
        if (running) {
            return Result.error(ErrorCode.VALIDATION_ERROR, "already running");
        }
        clock = new SimulationClock(this::tickAll, config.tickIntervalNanos(), new SystemNanoClock());
        clockRunner = new AgentRunner(new SleepingMillisIdleStrategy(1),
                t -> log.error("Clock duty cycle failed", t), null, clock);
        AgentRunner.startOnThread(clockRunner);
        running = true;
        journal.recordEvent("simulator.started", lanes.size());
        log.info("Simulator started with {} symbols", lanes.size());
        return Result.ok();
    }

    /**
     * Stops scheduling ticks once the tick in flight completes, then waits for
     * every fill produced so far to reach the sinks.
     */
    public synchronized Result<Void> stop() {
        if (!running) {
            return Result.ok();
        }
        clockRunner.close();
        running = false;
        boolean drained = fills.drain(5, TimeUnit.SECONDS);
        journal.recordEvent("simulator.stopped", clock.ticks());
        log.info("Simulator stopped after {} ticks", clock.ticks());
        return drained ? Result.ok() : Result.error(ErrorCode.UNAVAILABLE, "fill ring did not drain");
    }

    /**
     * Runs {@code n} ticks on the calling thread, for backtests. Not allowed
     * while the clock is running.
     */
    public Result<Void> runTicks(int n) {
        if (closed) {
            return Result.error(ErrorCode.UNAVAILABLE, "simulator is closed");
        }
        if (running) {
            return Result.error(ErrorCode.VALIDATION_ERROR, "clock is running");
        }
        if (n < 0) {
            return Result.error(ErrorCode.VALIDATION_ERROR, "tick count must not be negative: " + n);
        }
        for (int i = 0; i < n; i++) {
            tickAll();
        }
        fills.drain(5, TimeUnit.SECONDS);
        return Result.ok();
    }

    /**
     * One tick on every live lane, in parallel, returning when all are done.
     */
    void tickAll() {
        List<CompletableFuture<Result<SymbolSnapshot>>> pending = new ArrayList<>(lanes.size());
        for (SymbolLane lane : lanes) {
            if (!lane.isHalted()) {
                pending.add(lane.tick());
            }
        }
        CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();
    }

    public Result<Long> submitOrder(OrderRequest request) {
        if (request == null) {
            return Result.error(ErrorCode.VALIDATION_ERROR, "request is required");
        }
        SymbolLane lane = lane(request.symbol());
        if (lane == null) {
            return Result.error(ErrorCode.VALIDATION_ERROR, "unknown symbol " + request.symbol());
        }
        return await(lane, () -> lane.submit(request));
    }

    public Result<Void> cancelOrder(long orderId) {
        SymbolLane lane = laneOf(orderId);
        if (lane == null) {
            return Result.error(ErrorCode.NOT_FOUND, "unknown order " + orderId);
        }
        return await(lane, () -> lane.cancel(orderId));
    }

    public Result<OrderReport> getOrder(long orderId) {
        SymbolLane lane = laneOf(orderId);
        if (lane == null) {
            return Result.error(ErrorCode.NOT_FOUND, "unknown order " + orderId);
        }
        return await(lane, () -> lane.getOrder(orderId));
    }

    public Result<BookSnapshot> getOrderBook(String symbol, int depth) {
        if (depth <= 0) {
            return Result.error(ErrorCode.VALIDATION_ERROR, "depth must be positive: " + depth);
        }
        return snapshotOf(symbol).map(s -> s.book().truncate(depth));
    }

    public Result<MarketState> getMarketState(String symbol) {
        return snapshotOf(symbol).map(SymbolSnapshot::state);
    }

    public Result<AnalyticsSnapshot> getAnalytics(String symbol) {
        return snapshotOf(symbol).map(SymbolSnapshot::analytics);
    }

    public Result<List<Fill>> getRecentFills(String symbol, int limit) {
        SymbolLane lane = lane(symbol);
        if (lane == null) {
            return Result.error(ErrorCode.NOT_FOUND, "unknown symbol " + symbol);
        }
        return await(lane, () -> lane.recentFills(limit));
    }

    private Result<SymbolSnapshot> snapshotOf(String symbol) {
        SymbolLane lane = lane(symbol);
        if (lane == null) {
            return Result.error(ErrorCode.NOT_FOUND, "unknown symbol " + symbol);
        }
        return Result.ok(lane.snapshot());
    }

    private SymbolLane laneOf(long orderId) {
        int index = SymbolLane.indexOf(orderId);
        return index >= 0 && index < lanes.size() ? lanes.get(index) : null;
    }

    private <T> Result<T> await(SymbolLane lane, Supplier<CompletableFuture<Result<T>>> command) {
        if (closed) {
            return Result.error(ErrorCode.UNAVAILABLE, "simulator is closed");
        }
        if (lane.isHalted()) {
            return Result.error(ErrorCode.LANE_HALTED, lane.symbol() + " is halted: " + lane.haltReason());
        }
        return command.get().join();
    }

    public List<String> symbols() {
        List<String> symbols = new ArrayList<>(lanes.size());
        for (SymbolLane lane : lanes) {
            symbols.add(lane.symbol());
        }
        return symbols;
    }

    public boolean isHalted(String symbol) {
        SymbolLane lane = lane(symbol);
        return lane != null && lane.isHalted();
    }

    public List<String> haltedSymbols() {
        List<String> halted = new ArrayList<>();
        for (SymbolLane lane : lanes) {
            if (lane.isHalted()) {
                halted.add(lane.symbol());
            }
        }
        return halted;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Fills that have reached the journal and sinks.
     */
    public long publishedFills() {
        return fills.processed();
    }

    SymbolLane lane(String symbol) {
        return symbol == null ? null : lanesBySymbol.get(symbol);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        stop();
        closed = true;
        for (SymbolLane lane : lanes) {
            lane.shutdown();
        }
        fills.close();
        journal.close();
        log.info("Simulator closed");
    }
}
