package com.marketsim.core.market;

import com.marketsim.api.Side;
import com.marketsim.core.SimulationConfig;

/**
 * <b>Liquidity &amp; Market Impact.</b>
 * <p>
 * Tracks a single liquidity level per symbol: the depth that exists beyond the
 * visible book. Trading consumes it, time restores it toward the base.
 * </p>
 *
 * <h3>Square-root impact</h3>
 * <pre>
 *   impact = sign(side) * coefficient * sqrt(size / max(liquidity, 1))
 * </pre>
 * The result is a fraction of price: positive for buys, negative for sells.
 *
 * <h3>Recovery</h3>
 * <pre>
 *   level(t + n) = base - (base - level(t)) * (1 - decayRate)^n
 * </pre>
 * Monotone toward the base and never past it.
 */
public class LiquidityModel {

    private final double base;
    private final double decayRate;
    private final double consumptionRate;
    private final double impactCoefficient;
    private double level;

    public LiquidityModel(double base, double decayRate, double consumptionRate, double impactCoefficient) {
        this.base = base;
        this.decayRate = decayRate;
        this.consumptionRate = consumptionRate;
        this.impactCoefficient = impactCoefficient;
        this.level = base;
    }

    public LiquidityModel(SimulationConfig config) {
        this(config.baseLiquidity(), config.liquidityDecayRate(), config.consumptionRate(),
                config.impactCoefficient());
    }

    public double impact(Side side, long size, double liquidity) {
        if (size <= 0) {
            return 0.0;
        }
        return side.sign() * impactCoefficient * Math.sqrt(size / Math.max(liquidity, 1.0));
    }

    /**
     * Impact against the current level.
     */
    public double impact(Side side, long size) {
        return impact(side, size, level);
    }

    /**
     * The impact curve applied to net signed flow (buys minus sells).
     */
    public double signedFlowImpact(long netSignedQuantity) {
        if (netSignedQuantity == 0) {
            return 0.0;
        }
        Side side = netSignedQuantity > 0 ? Side.BUY : Side.SELL;
        return impact(side, Math.abs(netSignedQuantity), level);
    }

    public void applyConsumption(long consumed) {
        if (consumed <= 0) {
            return;
        }
        level = Math.max(0.0, level - consumed * consumptionRate);
    }

    public void decayTowardBase(long elapsedTicks) {
        if (elapsedTicks <= 0 || level >= base) {
            return;
        }
        level = base - (base - level) * Math.pow(1.0 - decayRate, elapsedTicks);
        if (level > base) {
            level = base;
        }
    }

    public double level() {
        return level;
    }

    public double base() {
        return base;
    }
}
