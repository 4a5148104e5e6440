package com.marketsim.infra;

import com.lmax.disruptor.EventHandler;
import com.marketsim.api.ErrorCode;
import com.marketsim.api.OrderValidationException;
import com.marketsim.core.InvariantViolationException;
import com.marketsim.core.SymbolEngine;
import com.marketsim.infra.journal.Journal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The consumer of a symbol lane: takes {@link LaneCommand}s off the ring and
 * runs them against the lane's {@link SymbolEngine}, one at a time.
 * <p>
 * A broken book invariant halts the lane for good. Everything after it is
 * answered with {@link ErrorCode#LANE_HALTED}; other lanes carry on.
 * </p>
 */
public class LaneCommandHandler implements EventHandler<LaneCommand> {

    private static final Logger log = LoggerFactory.getLogger(LaneCommandHandler.class);

    private final SymbolEngine engine;
    private final SymbolLane lane;
    private final Journal journal;

    public LaneCommandHandler(SymbolEngine engine, SymbolLane lane, Journal journal) {
        this.engine = engine;
        this.lane = lane;
        this.journal = journal;
    }

    @Override
    public void onEvent(LaneCommand event, long sequence, boolean endOfBatch) {
        LaneTask<?> task = event.task;
        event.reset();
        if (task == null) {
            return;
        }
        if (lane.isHalted()) {
            task.fail(ErrorCode.LANE_HALTED, engine.symbol() + " is halted: " + lane.haltReason());
            return;
        }
        try {
            task.run(engine);
        } catch (OrderValidationException e) {
            log.debug("{} refused an order: {}", engine.symbol(), e.getMessage());
            task.fail(ErrorCode.VALIDATION_ERROR, e.getMessage());
        } catch (InvariantViolationException e) {
            log.error("{} halted at tick {}: {}\n{}", engine.symbol(), engine.currentTick(), e.getMessage(),
                    e.getState(), e);
            journal.recordHalt(engine.symbol(), engine.currentTick(), e.getMessage(),
                    e.getState() != null ? e.getState() : engine.dump());
            lane.halt(e.getMessage());
            task.fail(ErrorCode.LANE_HALTED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} failed on a lane command", engine.symbol(), e);
            task.fail(ErrorCode.INTERNAL_ERROR, e.toString());
        }
    }
}
