package com.marketsim.infra;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.marketsim.api.ErrorCode;
import com.marketsim.api.Fill;
import com.marketsim.api.OrderReport;
import com.marketsim.api.OrderRequest;
import com.marketsim.api.Result;
import com.marketsim.core.SimulationConfig;
import com.marketsim.core.SymbolEngine;
import com.marketsim.core.SymbolSnapshot;
import com.marketsim.core.execution.ExecutionListener;
import com.marketsim.infra.journal.Journal;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * <b>Symbol Lane: One Symbol, One Thread.</b>
 * <p>
 * Every mutation of a symbol, and every query that needs live state, is
 * published as a {@link LaneCommand} into the lane's ring buffer and executed
 * by its single handler thread. Callers get a {@link CompletableFuture} that
 * the handler completes.
 * </p>
 *
 * <pre>
 * [clock / callers] --(multi producer)--&gt; (Lane Ring Buffer) --&gt; [LaneCommandHandler] --&gt; SymbolEngine
 * </pre>
 *
 * <p>
 * Snapshot reads skip the ring entirely: they return the engine's last
 * published {@link SymbolSnapshot}.
 * </p>
 */
public class SymbolLane {

    private final String symbol;
    private final int index;
    private final SymbolEngine engine;
    private final Disruptor<LaneCommand> disruptor;
    private RingBuffer<LaneCommand> ringBuffer;

    private volatile boolean halted;
    private volatile String haltReason;

    public SymbolLane(String symbol, double initialPrice, int index, SimulationConfig config,
            ExecutionListener fillListener, Journal journal) {
        this.symbol = symbol;
        this.index = index;
        this.engine = new SymbolEngine(symbol, initialPrice, index, config, fillListener);
        this.disruptor = new Disruptor<>(
                LaneCommand.FACTORY,
                config.laneRingSize(),
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(new LaneCommandHandler(engine, this, journal));
    }

    public void start() {
        this.ringBuffer = disruptor.start();
    }

    public CompletableFuture<Result<SymbolSnapshot>> tick() {
        return publish(LaneCommand.Type.TICK, new LaneTask<SymbolSnapshot>(e -> Result.ok(e.tick())));
    }

    public CompletableFuture<Result<Long>> submit(OrderRequest request) {
        return publish(LaneCommand.Type.SUBMIT, new LaneTask<Long>(e -> Result.ok(e.submit(request))));
    }

    public CompletableFuture<Result<Void>> cancel(long orderId) {
        return publish(LaneCommand.Type.CANCEL, new LaneTask<Void>(e -> e.cancel(orderId)
                ? Result.ok()
                : Result.<Void>error(ErrorCode.NOT_FOUND, "order " + orderId + " is not live")));
    }

    public CompletableFuture<Result<OrderReport>> getOrder(long orderId) {
        return publish(LaneCommand.Type.QUERY_ORDER, new LaneTask<OrderReport>(e -> {
            OrderReport report = e.getOrder(orderId);
            return report != null
                    ? Result.ok(report)
                    : Result.<OrderReport>error(ErrorCode.NOT_FOUND, "unknown order " + orderId);
        }));
    }

    public CompletableFuture<Result<List<Fill>>> recentFills(int limit) {
        return publish(LaneCommand.Type.RECENT_FILLS, new LaneTask<List<Fill>>(e -> Result.ok(e.recentFills(limit))));
    }

    private <T> CompletableFuture<Result<T>> publish(LaneCommand.Type type, LaneTask<T> task) {
        long sequence = ringBuffer.next();
        try {
            LaneCommand command = ringBuffer.get(sequence);
            command.type = type;
            command.task = task;
        } finally {
            ringBuffer.publish(sequence);
        }
        return task.reply();
    }

    /**
     * Last published snapshot; never blocks.
     */
    public SymbolSnapshot snapshot() {
        return engine.snapshot();
    }

    void halt(String reason) {
        this.haltReason = reason;
        this.halted = true;
    }

    public boolean isHalted() {
        return halted;
    }

    public String haltReason() {
        return haltReason;
    }

    public String symbol() {
        return symbol;
    }

    public int index() {
        return index;
    }

    /**
     * Lane that issued {@code orderId}, from the index folded into its high bits.
     */
    public static int indexOf(long orderId) {
        return (int) (orderId >>> 40) - 1;
    }

    /**
     * For tests and diagnostics only: the engine is owned by the lane thread.
     */
    SymbolEngine engine() {
        return engine;
    }

    /**
     * Waits for queued commands to finish, then stops the handler thread.
     */
    public void shutdown() {
        disruptor.shutdown();
    }
}
