package com.marketsim.infra;

import com.lmax.disruptor.EventFactory;

/**
 * Slot in a symbol lane's ring buffer: one thing for the lane to do, and where
 * to put the answer.
 */
public class LaneCommand {

    public enum Type {
        TICK,
        SUBMIT,
        CANCEL,
        QUERY_ORDER,
        RECENT_FILLS
    }

    public Type type;
    LaneTask<?> task;

    public void reset() {
        type = null;
        task = null;
    }

    public final static EventFactory<LaneCommand> FACTORY = LaneCommand::new;
}
