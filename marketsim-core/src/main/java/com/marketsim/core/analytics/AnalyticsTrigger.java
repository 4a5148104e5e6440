package com.marketsim.core.analytics;

public enum AnalyticsTrigger {
    /** Recompute at the end of every tick. */
    EVERY_TICK,
    /** Recompute once at least N new trades have printed since the last run. */
    EVERY_N_TRADES
}
