package com.marketsim.infra;

import com.lmax.disruptor.EventFactory;
import com.marketsim.api.Fill;

/**
 * Slot in the fill ring buffer.
 */
public class FillEvent {
    public Fill fill;

    public void reset() {
        fill = null;
    }

    public final static EventFactory<FillEvent> FACTORY = FillEvent::new;
}
