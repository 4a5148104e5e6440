package com.marketsim.infra.journal;

import com.marketsim.api.Fill;

/**
 * <b>Audit Journal.</b>
 * <p>
 * Append-only record of what the simulator did: every fill, every lane halt
 * and the lifecycle milestones. Diagnostics go through SLF4J; the journal is
 * for events someone may want to replay or reconcile later.
 * </p>
 * Implementations must accept calls from several threads.
 */
public interface Journal extends AutoCloseable {

    Journal NONE = new Journal() {
        @Override
        public void recordFill(Fill fill) {
        }

        @Override
        public void recordHalt(String symbol, long tick, String reason, String state) {
        }

        @Override
        public void recordEvent(CharSequence event, long value) {
        }

        @Override
        public void close() {
        }
    };

    void recordFill(Fill fill);

    /**
     * @param state book dump at the time of the failure
     */
    void recordHalt(String symbol, long tick, String reason, String state);

    void recordEvent(CharSequence event, long value);

    @Override
    void close();
}
