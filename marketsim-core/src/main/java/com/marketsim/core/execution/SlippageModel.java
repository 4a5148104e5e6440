package com.marketsim.core.execution;

/**
 * Shape of the execution cost curve, as a function of order size relative to
 * the liquidity level. The result is a fraction of price, always non-negative;
 * the execution engine applies it against the taker.
 */
public enum SlippageModel {
    NONE {
        @Override
        double shape(double ratio) {
            return 0.0;
        }
    },
    LINEAR {
        @Override
        double shape(double ratio) {
            return ratio;
        }
    },
    SQUARE_ROOT {
        @Override
        double shape(double ratio) {
            return Math.sqrt(ratio);
        }
    },
    QUADRATIC {
        @Override
        double shape(double ratio) {
            return ratio * ratio;
        }
    };

    abstract double shape(double ratio);

    public double fraction(long size, double liquidity, double coefficient) {
        if (size <= 0) {
            return 0.0;
        }
        return coefficient * shape(size / Math.max(liquidity, 1.0));
    }
}
