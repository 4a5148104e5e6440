package com.marketsim.api;

public enum OrderType {
    MARKET(false, false),
    LIMIT(true, false),
    STOP(false, true),
    STOP_LIMIT(true, true);

    private final boolean limitPriced;
    private final boolean stopPriced;

    OrderType(boolean limitPriced, boolean stopPriced) {
        this.limitPriced = limitPriced;
        this.stopPriced = stopPriced;
    }

    public boolean requiresLimitPrice() {
        return limitPriced;
    }

    public boolean requiresStopPrice() {
        return stopPriced;
    }

    /**
     * The type a stop order becomes once its trigger fires.
     */
    public OrderType triggeredType() {
        switch (this) {
            case STOP:
                return MARKET;
            case STOP_LIMIT:
                return LIMIT;
            default:
                return this;
        }
    }
}
