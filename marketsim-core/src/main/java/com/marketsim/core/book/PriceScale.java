package com.marketsim.core.book;

/**
 * Converts between quote prices (doubles at the API) and integer ticks (the
 * book's keys). With a tick size that divides 1, such as 0.01, conversions go
 * through an exact ticks-per-unit divisor so 10050 ticks reads back as exactly
 * 100.5.
 */
public final class PriceScale {

    /**
     * Highest price in ticks an order may carry; sums of two prices stay exact
     * in a {@code double}.
     */
    public static final long MAX_TICKS = 1L << 52;

    private final double tickSize;
    private final double ticksPerUnit;

    public PriceScale(double tickSize) {
        if (!(tickSize > 0) || Double.isInfinite(tickSize)) {
            throw new IllegalArgumentException("tick size must be positive: " + tickSize);
        }
        this.tickSize = tickSize;
        double inverse = 1.0 / tickSize;
        this.ticksPerUnit = Math.abs(inverse - Math.rint(inverse)) < 1e-9 ? Math.rint(inverse) : inverse;
    }

    public double tickSize() {
        return tickSize;
    }

    /**
     * Rounds to the nearest tick.
     */
    public long toTicks(double price) {
        return Math.round(price * ticksPerUnit);
    }

    public double toPrice(long ticks) {
        return ticks / ticksPerUnit;
    }

    public double toPrice(double ticks) {
        return ticks / ticksPerUnit;
    }
}
