package com.marketsim.core.market;

import com.marketsim.core.SimulationConfig;

import java.util.Random;

/**
 * <h1>Price Discovery: The Reference Price Process</h1>
 *
 * <p>
 * Advances one symbol's reference price once per tick. No matching happens
 * here; the result feeds {@code MarketState} and is the price agents quote
 * around when the book has no mid.
 * </p>
 *
 * <h2>The Step</h2>
 * <pre>
 *   momentum  = momentumFactor * meanReturn(last 5 prices) * p
 *   reversion = meanReversionRate * (rollingMean(window) - p)
 *   noise     = volatility * p * N(0, 1)
 *   flow      = p * liquidity.signedFlowImpact(net flow of the previous tick)
 *
 *   next = p + momentum + reversion + noise + flow
 *   next = next + anchorWeight * (mid - next)      (only with a two-sided book)
 *   next = max(next, 0.5 * p, one tick)
 * </pre>
 *
 * <p>
 * All randomness comes from the {@link Random} handed in, so a given seed
 * replays the same path. Each shock is drawn one step ahead, which is what
 * {@link #previewNextMove()} leaks to informed traders.
 * </p>
 */
public class PriceDiscovery {

    private static final int MOMENTUM_LOOKBACK = 5;
    private static final int MIN_VOLATILITY_SAMPLES = 10;

    private final double momentumFactor;
    private final double meanReversionRate;
    private final int meanReversionWindow;
    private final double volatility;
    private final int volatilityWindow;
    private final double anchorWeight;
    private final double tickSize;
    private final LiquidityModel liquidity;
    private final Random random;

    private final PriceWindow history;
    private double price;
    private double nextShock;
    private double momentum;
    private double realizedVolatility;

    public PriceDiscovery(SimulationConfig config, double initialPrice, LiquidityModel liquidity, Random random) {
        if (!(initialPrice > 0) || Double.isInfinite(initialPrice)) {
            throw new IllegalArgumentException("initial price must be positive: " + initialPrice);
        }
        this.momentumFactor = config.momentumFactor();
        this.meanReversionRate = config.meanReversionRate();
        this.meanReversionWindow = config.meanReversionWindow();
        this.volatility = config.volatility();
        this.volatilityWindow = config.volatilityWindow();
        this.anchorWeight = config.anchorWeight();
        this.tickSize = config.tickSize();
        this.liquidity = liquidity;
        this.random = random;

        int capacity = Math.max(100, Math.max(meanReversionWindow, volatilityWindow + 1));
        this.history = new PriceWindow(capacity);
        this.history.add(initialPrice);
        this.price = initialPrice;
        this.realizedVolatility = volatility;
        this.nextShock = random.nextGaussian();
    }

    /**
     * Runs one tick.
     *
     * @param priorNetFlow signed quantity traded by takers in the previous tick
     *                     (buys positive)
     * @param midPrice     current book mid, NaN when the book is one-sided
     * @return the new reference price
     */
    public double step(long priorNetFlow, double midPrice) {
        double p = price;
        double next = p + momentumTerm(p) + reversionTerm(p)
                + volatility * p * nextShock
                + p * liquidity.signedFlowImpact(priorNetFlow);

        if (!Double.isNaN(midPrice)) {
            next += anchorWeight * (midPrice - next);
        }
        next = Math.max(next, Math.max(0.5 * p, tickSize));

        nextShock = random.nextGaussian();
        momentum = next / p - 1.0;
        price = next;
        history.add(next);
        realizedVolatility = history.size() > MIN_VOLATILITY_SAMPLES
                ? history.logReturnStdDev(volatilityWindow + 1)
                : volatility;
        return next;
    }

    private double momentumTerm(double p) {
        return momentumFactor * history.meanReturn(MOMENTUM_LOOKBACK) * p;
    }

    private double reversionTerm(double p) {
        return meanReversionRate * (history.mean(meanReversionWindow) - p);
    }

    /**
     * The next step as far as it is already decided, in price units: momentum,
     * reversion and the shock drawn for it. Only the flow of the current tick
     * and the book anchor are left out. Informed traders see a noisy copy of it.
     */
    public double previewNextMove() {
        return momentumTerm(price) + reversionTerm(price) + volatility * price * nextShock;
    }

    public double price() {
        return price;
    }

    /**
     * Relative change of the last step.
     */
    public double momentum() {
        return momentum;
    }

    /**
     * Std of log returns over the window; the configured volatility until
     * enough history exists.
     */
    public double realizedVolatility() {
        return realizedVolatility;
    }

    public PriceWindow history() {
        return history;
    }
}
