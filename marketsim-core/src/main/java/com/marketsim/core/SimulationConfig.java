package com.marketsim.core;

import com.marketsim.api.OrderRequest;
import com.marketsim.core.analytics.AnalyticsTrigger;
import com.marketsim.core.execution.MarketRemainderPolicy;
import com.marketsim.core.execution.SlippageModel;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * <b>Simulation configuration.</b>
 * <p>
 * Supplied once when a simulator is built and never changed while it runs.
 * Build one with {@link #builder()}, or read {@code marketsim.*} keys with
 * {@link #fromProperties(Properties)} / {@link #load(String)}; any key left out
 * keeps its default.
 * </p>
 *
 * <h3>Units</h3>
 * <ul>
 * <li>Rates, coefficients, spreads and offsets are fractions of price (0.001 = 10 bp).</li>
 * <li>Sizes are whole lots.</li>
 * <li>Probabilities are per agent per tick.</li>
 * </ul>
 */
public final class SimulationConfig {

    public static final String PREFIX = "marketsim.";
    public static final String DEFAULT_RESOURCE = "marketsim.properties";

    // Clock and book
    private final long tickIntervalMillis;
    private final int maxBookDepth;
    private final double tickSize;
    private final int laneRingSize;
    private final int fillRingSize;
    private final long seed;

    // Liquidity
    private final double baseLiquidity;
    private final double liquidityDecayRate;
    private final double consumptionRate;
    private final double impactCoefficient;

    // Price discovery
    private final double momentumFactor;
    private final double meanReversionRate;
    private final int meanReversionWindow;
    private final double volatility;
    private final int volatilityWindow;
    private final double anchorWeight;

    // Execution
    private final SlippageModel slippageModel;
    private final double slippageCoefficient;
    private final long latencyMicros;
    private final MarketRemainderPolicy marketRemainderPolicy;
    private final int fillLedgerCapacity;
    private final int orderHistoryCapacity;

    // Agent population
    private final int marketMakers;
    private final int noiseTraders;
    private final int informedTraders;
    private final int momentumTraders;

    // Agent behaviour
    private final double makerSpread;
    private final long makerQuoteSize;
    private final int makerRequoteInterval;
    private final long makerMaxInventory;
    private final double makerInventorySkew;
    private final double noiseProbability;
    private final long noiseMinSize;
    private final long noiseMaxSize;
    private final double noiseMarketRatio;
    private final double noiseLimitOffset;
    private final double informedProbability;
    private final long informedSize;
    private final double informedThreshold;
    private final double informedSignalNoise;
    private final double momentumProbability;
    private final long momentumSize;
    private final double momentumThreshold;
    private final double momentumOffset;

    // Analytics
    private final AnalyticsTrigger analyticsTrigger;
    private final int analyticsTradeInterval;
    private final int analyticsTradeWindow;
    private final int analyticsVolatilityWindow;
    private final int analyticsLevels;

    private SimulationConfig(Builder b) {
        this.tickIntervalMillis = b.tickIntervalMillis;
        this.maxBookDepth = b.maxBookDepth;
        this.tickSize = b.tickSize;
        this.laneRingSize = b.laneRingSize;
        this.fillRingSize = b.fillRingSize;
        this.seed = b.seed;
        this.baseLiquidity = b.baseLiquidity;
        this.liquidityDecayRate = b.liquidityDecayRate;
        this.consumptionRate = b.consumptionRate;
        this.impactCoefficient = b.impactCoefficient;
        this.momentumFactor = b.momentumFactor;
        this.meanReversionRate = b.meanReversionRate;
        this.meanReversionWindow = b.meanReversionWindow;
        this.volatility = b.volatility;
        this.volatilityWindow = b.volatilityWindow;
        this.anchorWeight = b.anchorWeight;
        this.slippageModel = b.slippageModel;
        this.slippageCoefficient = b.slippageCoefficient;
        this.latencyMicros = b.latencyMicros;
        this.marketRemainderPolicy = b.marketRemainderPolicy;
        this.fillLedgerCapacity = b.fillLedgerCapacity;
        this.orderHistoryCapacity = b.orderHistoryCapacity;
        this.marketMakers = b.marketMakers;
        this.noiseTraders = b.noiseTraders;
        this.informedTraders = b.informedTraders;
        this.momentumTraders = b.momentumTraders;
        this.makerSpread = b.makerSpread;
        this.makerQuoteSize = b.makerQuoteSize;
        this.makerRequoteInterval = b.makerRequoteInterval;
        this.makerMaxInventory = b.makerMaxInventory;
        this.makerInventorySkew = b.makerInventorySkew;
        this.noiseProbability = b.noiseProbability;
        this.noiseMinSize = b.noiseMinSize;
        this.noiseMaxSize = b.noiseMaxSize;
        this.noiseMarketRatio = b.noiseMarketRatio;
        this.noiseLimitOffset = b.noiseLimitOffset;
        this.informedProbability = b.informedProbability;
        this.informedSize = b.informedSize;
        this.informedThreshold = b.informedThreshold;
        this.informedSignalNoise = b.informedSignalNoise;
        this.momentumProbability = b.momentumProbability;
        this.momentumSize = b.momentumSize;
        this.momentumThreshold = b.momentumThreshold;
        this.momentumOffset = b.momentumOffset;
        this.analyticsTrigger = b.analyticsTrigger;
        this.analyticsTradeInterval = b.analyticsTradeInterval;
        this.analyticsTradeWindow = b.analyticsTradeWindow;
        this.analyticsVolatilityWindow = b.analyticsVolatilityWindow;
        this.analyticsLevels = b.analyticsLevels;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SimulationConfig defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Reads a classpath resource of {@code marketsim.*} properties. A missing
     * resource yields the defaults.
     */
    public static SimulationConfig load(String resourceName) {
        Properties properties = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SimulationConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + resourceName, e);
        }
        return fromProperties(properties);
    }

    /**
     * @throws IllegalArgumentException on a value that does not parse or is out of range
     */
    public static SimulationConfig fromProperties(Properties p) {
        Builder b = builder();
        SimulationConfig d = b.build();
        b.tickIntervalMillis(getLong(p, "tick.interval.millis", d.tickIntervalMillis))
                .maxBookDepth(getInt(p, "book.max.depth", d.maxBookDepth))
                .tickSize(getDouble(p, "book.tick.size", d.tickSize))
                .laneRingSize(getInt(p, "lane.ring.size", d.laneRingSize))
                .fillRingSize(getInt(p, "fill.ring.size", d.fillRingSize))
                .seed(getLong(p, "seed", d.seed))
                .baseLiquidity(getDouble(p, "liquidity.base", d.baseLiquidity))
                .liquidityDecayRate(getDouble(p, "liquidity.decay.rate", d.liquidityDecayRate))
                .consumptionRate(getDouble(p, "liquidity.consumption.rate", d.consumptionRate))
                .impactCoefficient(getDouble(p, "liquidity.impact.coefficient", d.impactCoefficient))
                .momentumFactor(getDouble(p, "price.momentum.factor", d.momentumFactor))
                .meanReversionRate(getDouble(p, "price.mean.reversion.rate", d.meanReversionRate))
                .meanReversionWindow(getInt(p, "price.mean.reversion.window", d.meanReversionWindow))
                .volatility(getDouble(p, "price.volatility", d.volatility))
                .volatilityWindow(getInt(p, "price.volatility.window", d.volatilityWindow))
                .anchorWeight(getDouble(p, "price.anchor.weight", d.anchorWeight))
                .slippageModel(getEnum(p, "execution.slippage.model", SlippageModel.class, d.slippageModel))
                .slippageCoefficient(getDouble(p, "execution.slippage.coefficient", d.slippageCoefficient))
                .latencyMicros(getLong(p, "execution.latency.micros", d.latencyMicros))
                .marketRemainderPolicy(getEnum(p, "execution.market.remainder", MarketRemainderPolicy.class,
                        d.marketRemainderPolicy))
                .fillLedgerCapacity(getInt(p, "execution.fill.ledger.capacity", d.fillLedgerCapacity))
                .orderHistoryCapacity(getInt(p, "execution.order.history.capacity", d.orderHistoryCapacity))
                .marketMakers(getInt(p, "agents.market.makers", d.marketMakers))
                .noiseTraders(getInt(p, "agents.noise.traders", d.noiseTraders))
                .informedTraders(getInt(p, "agents.informed.traders", d.informedTraders))
                .momentumTraders(getInt(p, "agents.momentum.traders", d.momentumTraders))
                .makerSpread(getDouble(p, "agents.maker.spread", d.makerSpread))
                .makerQuoteSize(getLong(p, "agents.maker.quote.size", d.makerQuoteSize))
                .makerRequoteInterval(getInt(p, "agents.maker.requote.interval", d.makerRequoteInterval))
                .makerMaxInventory(getLong(p, "agents.maker.max.inventory", d.makerMaxInventory))
                .makerInventorySkew(getDouble(p, "agents.maker.inventory.skew", d.makerInventorySkew))
                .noiseProbability(getDouble(p, "agents.noise.probability", d.noiseProbability))
                .noiseMinSize(getLong(p, "agents.noise.min.size", d.noiseMinSize))
                .noiseMaxSize(getLong(p, "agents.noise.max.size", d.noiseMaxSize))
                .noiseMarketRatio(getDouble(p, "agents.noise.market.ratio", d.noiseMarketRatio))
                .noiseLimitOffset(getDouble(p, "agents.noise.limit.offset", d.noiseLimitOffset))
                .informedProbability(getDouble(p, "agents.informed.probability", d.informedProbability))
                .informedSize(getLong(p, "agents.informed.size", d.informedSize))
                .informedThreshold(getDouble(p, "agents.informed.threshold", d.informedThreshold))
                .informedSignalNoise(getDouble(p, "agents.informed.signal.noise", d.informedSignalNoise))
                .momentumProbability(getDouble(p, "agents.momentum.probability", d.momentumProbability))
                .momentumSize(getLong(p, "agents.momentum.size", d.momentumSize))
                .momentumThreshold(getDouble(p, "agents.momentum.threshold", d.momentumThreshold))
                .momentumOffset(getDouble(p, "agents.momentum.offset", d.momentumOffset))
                .analyticsTrigger(getEnum(p, "analytics.trigger", AnalyticsTrigger.class, d.analyticsTrigger))
                .analyticsTradeInterval(getInt(p, "analytics.trade.interval", d.analyticsTradeInterval))
                .analyticsTradeWindow(getInt(p, "analytics.trade.window", d.analyticsTradeWindow))
                .analyticsVolatilityWindow(getInt(p, "analytics.volatility.window", d.analyticsVolatilityWindow))
                .analyticsLevels(getInt(p, "analytics.levels", d.analyticsLevels));
        return b.build();
    }

    private static String raw(Properties p, String key) {
        String value = p.getProperty(PREFIX + key);
        return value == null ? null : value.trim();
    }

    private static long getLong(Properties p, String key, long fallback) {
        String value = raw(p, key);
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.replace("_", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not an integer: " + value, e);
        }
    }

    private static int getInt(Properties p, String key, int fallback) {
        return Math.toIntExact(getLong(p, key, fallback));
    }

    private static double getDouble(Properties p, String key, double fallback) {
        String value = raw(p, key);
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not a number: " + value, e);
        }
    }

    private static <E extends Enum<E>> E getEnum(Properties p, String key, Class<E> type, E fallback) {
        String value = raw(p, key);
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not a " + type.getSimpleName() + ": " + value, e);
        }
    }

    public long tickIntervalMillis() {
        return tickIntervalMillis;
    }

    /**
     * Simulated nanoseconds per tick.
     */
    public long tickIntervalNanos() {
        return tickIntervalMillis * 1_000_000L;
    }

    public int maxBookDepth() {
        return maxBookDepth;
    }

    public double tickSize() {
        return tickSize;
    }

    public int laneRingSize() {
        return laneRingSize;
    }

    public int fillRingSize() {
        return fillRingSize;
    }

    public long seed() {
        return seed;
    }

    public double baseLiquidity() {
        return baseLiquidity;
    }

    public double liquidityDecayRate() {
        return liquidityDecayRate;
    }

    public double consumptionRate() {
        return consumptionRate;
    }

    public double impactCoefficient() {
        return impactCoefficient;
    }

    public double momentumFactor() {
        return momentumFactor;
    }

    public double meanReversionRate() {
        return meanReversionRate;
    }

    public int meanReversionWindow() {
        return meanReversionWindow;
    }

    public double volatility() {
        return volatility;
    }

    public int volatilityWindow() {
        return volatilityWindow;
    }

    public double anchorWeight() {
        return anchorWeight;
    }

    public SlippageModel slippageModel() {
        return slippageModel;
    }

    public double slippageCoefficient() {
        return slippageCoefficient;
    }

    public long latencyMicros() {
        return latencyMicros;
    }

    public long latencyNanos() {
        return latencyMicros * 1_000L;
    }

    public MarketRemainderPolicy marketRemainderPolicy() {
        return marketRemainderPolicy;
    }

    public int fillLedgerCapacity() {
        return fillLedgerCapacity;
    }

    public int orderHistoryCapacity() {
        return orderHistoryCapacity;
    }

    public int marketMakers() {
        return marketMakers;
    }

    public int noiseTraders() {
        return noiseTraders;
    }

    public int informedTraders() {
        return informedTraders;
    }

    public int momentumTraders() {
        return momentumTraders;
    }

    public int totalAgents() {
        return marketMakers + noiseTraders + informedTraders + momentumTraders;
    }

    public double makerSpread() {
        return makerSpread;
    }

    public long makerQuoteSize() {
        return makerQuoteSize;
    }

    public int makerRequoteInterval() {
        return makerRequoteInterval;
    }

    public long makerMaxInventory() {
        return makerMaxInventory;
    }

    public double makerInventorySkew() {
        return makerInventorySkew;
    }

    public double noiseProbability() {
        return noiseProbability;
    }

    public long noiseMinSize() {
        return noiseMinSize;
    }

    public long noiseMaxSize() {
        return noiseMaxSize;
    }

    public double noiseMarketRatio() {
        return noiseMarketRatio;
    }

    public double noiseLimitOffset() {
        return noiseLimitOffset;
    }

    public double informedProbability() {
        return informedProbability;
    }

    public long informedSize() {
        return informedSize;
    }

    public double informedThreshold() {
        return informedThreshold;
    }

    public double informedSignalNoise() {
        return informedSignalNoise;
    }

    public double momentumProbability() {
        return momentumProbability;
    }

    public long momentumSize() {
        return momentumSize;
    }

    public double momentumThreshold() {
        return momentumThreshold;
    }

    public double momentumOffset() {
        return momentumOffset;
    }

    public AnalyticsTrigger analyticsTrigger() {
        return analyticsTrigger;
    }

    public int analyticsTradeInterval() {
        return analyticsTradeInterval;
    }

    public int analyticsTradeWindow() {
        return analyticsTradeWindow;
    }

    public int analyticsVolatilityWindow() {
        return analyticsVolatilityWindow;
    }

    public int analyticsLevels() {
        return analyticsLevels;
    }

    @Override
    public String toString() {
        return "SimulationConfig{" +
                "tick=" + tickIntervalMillis + "ms" +
                ", tickSize=" + tickSize +
                ", seed=" + seed +
                ", liquidity=" + baseLiquidity +
                ", agents=" + marketMakers + "/" + noiseTraders + "/" + informedTraders + "/" + momentumTraders +
                ", slippage=" + slippageModel + "(" + slippageCoefficient + ")" +
                ", latency=" + latencyMicros + "us" +
                ", remainder=" + marketRemainderPolicy +
                ", analytics=" + analyticsTrigger +
                '}';
    }

    public static final class Builder {
        private long tickIntervalMillis = 100;
        private int maxBookDepth = 20;
        private double tickSize = 0.01;
        private int laneRingSize = 1024;
        private int fillRingSize = 16384;
        private long seed = 42L;

        private double baseLiquidity = 10_000;
        private double liquidityDecayRate = 0.1;
        private double consumptionRate = 0.1;
        private double impactCoefficient = 0.1;

        private double momentumFactor = 0.5;
        private double meanReversionRate = 0.01;
        private int meanReversionWindow = 20;
        private double volatility = 0.001;
        private int volatilityWindow = 20;
        private double anchorWeight = 0.1;

        private SlippageModel slippageModel = SlippageModel.SQUARE_ROOT;
        private double slippageCoefficient = 0.01;
        private long latencyMicros = 1_000;
        private MarketRemainderPolicy marketRemainderPolicy = MarketRemainderPolicy.CANCEL;
        private int fillLedgerCapacity = 10_000;
        private int orderHistoryCapacity = 10_000;

        private int marketMakers = 5;
        private int noiseTraders = 20;
        private int informedTraders = 10;
        private int momentumTraders = 5;

        private double makerSpread = 0.001;
        private long makerQuoteSize = 100;
        private int makerRequoteInterval = 5;
        private long makerMaxInventory = 1_000;
        private double makerInventorySkew = 1.0;
        private double noiseProbability = 0.05;
        private long noiseMinSize = 10;
        private long noiseMaxSize = 50;
        private double noiseMarketRatio = 0.7;
        private double noiseLimitOffset = 0.01;
        private double informedProbability = 0.1;
        private long informedSize = 75;
        private double informedThreshold = 0.002;
        private double informedSignalNoise = 0.001;
        private double momentumProbability = 0.08;
        private long momentumSize = 60;
        private double momentumThreshold = 0.001;
        private double momentumOffset = 0.0005;

        private AnalyticsTrigger analyticsTrigger = AnalyticsTrigger.EVERY_TICK;
        private int analyticsTradeInterval = 10;
        private int analyticsTradeWindow = 100;
        private int analyticsVolatilityWindow = 20;
        private int analyticsLevels = 5;

        private Builder() {
        }

        private Builder(SimulationConfig c) {
            this.tickIntervalMillis = c.tickIntervalMillis;
            this.maxBookDepth = c.maxBookDepth;
            this.tickSize = c.tickSize;
            this.laneRingSize = c.laneRingSize;
            this.fillRingSize = c.fillRingSize;
            this.seed = c.seed;
            this.baseLiquidity = c.baseLiquidity;
            this.liquidityDecayRate = c.liquidityDecayRate;
            this.consumptionRate = c.consumptionRate;
            this.impactCoefficient = c.impactCoefficient;
            this.momentumFactor = c.momentumFactor;
            this.meanReversionRate = c.meanReversionRate;
            this.meanReversionWindow = c.meanReversionWindow;
            this.volatility = c.volatility;
            this.volatilityWindow = c.volatilityWindow;
            this.anchorWeight = c.anchorWeight;
            this.slippageModel = c.slippageModel;
            this.slippageCoefficient = c.slippageCoefficient;
            this.latencyMicros = c.latencyMicros;
            this.marketRemainderPolicy = c.marketRemainderPolicy;
            this.fillLedgerCapacity = c.fillLedgerCapacity;
            this.orderHistoryCapacity = c.orderHistoryCapacity;
            this.marketMakers = c.marketMakers;
            this.noiseTraders = c.noiseTraders;
            this.informedTraders = c.informedTraders;
            this.momentumTraders = c.momentumTraders;
            this.makerSpread = c.makerSpread;
            this.makerQuoteSize = c.makerQuoteSize;
            this.makerRequoteInterval = c.makerRequoteInterval;
            this.makerMaxInventory = c.makerMaxInventory;
            this.makerInventorySkew = c.makerInventorySkew;
            this.noiseProbability = c.noiseProbability;
            this.noiseMinSize = c.noiseMinSize;
            this.noiseMaxSize = c.noiseMaxSize;
            this.noiseMarketRatio = c.noiseMarketRatio;
            this.noiseLimitOffset = c.noiseLimitOffset;
            this.informedProbability = c.informedProbability;
            this.informedSize = c.informedSize;
            this.informedThreshold = c.informedThreshold;
            this.informedSignalNoise = c.informedSignalNoise;
            this.momentumProbability = c.momentumProbability;
            this.momentumSize = c.momentumSize;
            this.momentumThreshold = c.momentumThreshold;
            this.momentumOffset = c.momentumOffset;
            this.analyticsTrigger = c.analyticsTrigger;
            this.analyticsTradeInterval = c.analyticsTradeInterval;
            this.analyticsTradeWindow = c.analyticsTradeWindow;
            this.analyticsVolatilityWindow = c.analyticsVolatilityWindow;
            this.analyticsLevels = c.analyticsLevels;
        }

        public Builder tickIntervalMillis(long v) {
            this.tickIntervalMillis = v;
            return this;
        }

        public Builder maxBookDepth(int v) {
            this.maxBookDepth = v;
            return this;
        }

        public Builder tickSize(double v) {
            this.tickSize = v;
            return this;
        }

        public Builder laneRingSize(int v) {
            this.laneRingSize = v;
            return this;
        }

        public Builder fillRingSize(int v) {
            this.fillRingSize = v;
            return this;
        }

        public Builder seed(long v) {
            this.seed = v;
            return this;
        }

        public Builder baseLiquidity(double v) {
            this.baseLiquidity = v;
            return this;
        }

        public Builder liquidityDecayRate(double v) {
            this.liquidityDecayRate = v;
            return this;
        }

        public Builder consumptionRate(double v) {
            this.consumptionRate = v;
            return this;
        }

        public Builder impactCoefficient(double v) {
            this.impactCoefficient = v;
            return this;
        }

        public Builder momentumFactor(double v) {
            this.momentumFactor = v;
            return this;
        }

        public Builder meanReversionRate(double v) {
            this.meanReversionRate = v;
            return this;
        }

        public Builder meanReversionWindow(int v) {
            this.meanReversionWindow = v;
            return this;
        }

        public Builder volatility(double v) {
            this.volatility = v;
            return this;
        }

        public Builder volatilityWindow(int v) {
            this.volatilityWindow = v;
            return this;
        }

        public Builder anchorWeight(double v) {
            this.anchorWeight = v;
            return this;
        }

        public Builder slippageModel(SlippageModel v) {
            this.slippageModel = v;
            return this;
        }

        public Builder slippageCoefficient(double v) {
            this.slippageCoefficient = v;
            return this;
        }

        public Builder latencyMicros(long v) {
            this.latencyMicros = v;
            return this;
        }

        public Builder marketRemainderPolicy(MarketRemainderPolicy v) {
            this.marketRemainderPolicy = v;
            return this;
        }

        public Builder fillLedgerCapacity(int v) {
            this.fillLedgerCapacity = v;
            return this;
        }

        public Builder orderHistoryCapacity(int v) {
            this.orderHistoryCapacity = v;
            return this;
        }

        public Builder marketMakers(int v) {
            this.marketMakers = v;
            return this;
        }

        public Builder noiseTraders(int v) {
            this.noiseTraders = v;
            return this;
        }

        public Builder informedTraders(int v) {
            this.informedTraders = v;
            return this;
        }

        public Builder momentumTraders(int v) {
            this.momentumTraders = v;
            return this;
        }

        /**
         * Shorthand for a run with no simulated participants, only external orders.
         */
        public Builder noAgents() {
            return marketMakers(0).noiseTraders(0).informedTraders(0).momentumTraders(0);
        }

        public Builder makerSpread(double v) {
            this.makerSpread = v;
            return this;
        }

        public Builder makerQuoteSize(long v) {
            this.makerQuoteSize = v;
            return this;
        }

        public Builder makerRequoteInterval(int v) {
            this.makerRequoteInterval = v;
            return this;
        }

        public Builder makerMaxInventory(long v) {
            this.makerMaxInventory = v;
            return this;
        }

        public Builder makerInventorySkew(double v) {
            this.makerInventorySkew = v;
            return this;
        }

        public Builder noiseProbability(double v) {
            this.noiseProbability = v;
            return this;
        }

        public Builder noiseMinSize(long v) {
            this.noiseMinSize = v;
            return this;
        }

        public Builder noiseMaxSize(long v) {
            this.noiseMaxSize = v;
            return this;
        }

        public Builder noiseMarketRatio(double v) {
            this.noiseMarketRatio = v;
            return this;
        }

        public Builder noiseLimitOffset(double v) {
            this.noiseLimitOffset = v;
            return this;
        }

        public Builder informedProbability(double v) {
            this.informedProbability = v;
            return this;
        }

        public Builder informedSize(long v) {
            this.informedSize = v;
            return this;
        }

        public Builder informedThreshold(double v) {
            this.informedThreshold = v;
            return this;
        }

        public Builder informedSignalNoise(double v) {
            this.informedSignalNoise = v;
            return this;
        }

        public Builder momentumProbability(double v) {
            this.momentumProbability = v;
            return this;
        }

        public Builder momentumSize(long v) {
            this.momentumSize = v;
            return this;
        }

        public Builder momentumThreshold(double v) {
            this.momentumThreshold = v;
            return this;
        }

        public Builder momentumOffset(double v) {
            this.momentumOffset = v;
            return this;
        }

        public Builder analyticsTrigger(AnalyticsTrigger v) {
            this.analyticsTrigger = v;
            return this;
        }

        public Builder analyticsTradeInterval(int v) {
            this.analyticsTradeInterval = v;
            return this;
        }

        public Builder analyticsTradeWindow(int v) {
            this.analyticsTradeWindow = v;
            return this;
        }

        public Builder analyticsVolatilityWindow(int v) {
            this.analyticsVolatilityWindow = v;
            return this;
        }

        public Builder analyticsLevels(int v) {
            this.analyticsLevels = v;
            return this;
        }

        public SimulationConfig build() {
            require(tickIntervalMillis > 0, "tick interval must be positive");
            require(maxBookDepth > 0, "max book depth must be positive");
            require(tickSize > 0 && !Double.isInfinite(tickSize), "tick size must be positive");
            require(Integer.bitCount(laneRingSize) == 1, "lane ring size must be a power of two");
            require(Integer.bitCount(fillRingSize) == 1, "fill ring size must be a power of two");
            require(baseLiquidity > 0, "base liquidity must be positive");
            require(inUnitInterval(liquidityDecayRate), "liquidity decay rate must be in [0, 1]");
            require(consumptionRate >= 0, "consumption rate must not be negative");
            require(impactCoefficient >= 0, "impact coefficient must not be negative");
            require(inUnitInterval(meanReversionRate), "mean reversion rate must be in [0, 1]");
            require(meanReversionWindow >= 1, "mean reversion window must be at least 1");
            require(volatility >= 0, "volatility must not be negative");
            require(volatilityWindow >= 2, "volatility window must be at least 2");
            require(inUnitInterval(anchorWeight), "anchor weight must be in [0, 1]");
            require(slippageModel != null, "slippage model is required");
            require(slippageCoefficient >= 0, "slippage coefficient must not be negative");
            require(latencyMicros >= 0, "latency must not be negative");
            require(marketRemainderPolicy != null, "market remainder policy is required");
            require(fillLedgerCapacity > 0 && orderHistoryCapacity > 0, "capacities must be positive");
            require(marketMakers >= 0 && noiseTraders >= 0 && informedTraders >= 0 && momentumTraders >= 0,
                    "agent counts must not be negative");
            require(makerSpread > 0, "maker spread must be positive");
            require(makerQuoteSize > 0 && makerRequoteInterval > 0 && makerMaxInventory > 0,
                    "maker size, interval and inventory limit must be positive");
            require(noiseMinSize > 0 && noiseMinSize <= noiseMaxSize, "noise sizes must satisfy 0 < min <= max");
            require(informedSize > 0 && momentumSize > 0, "agent sizes must be positive");
            require(Math.max(Math.max(makerQuoteSize, noiseMaxSize), Math.max(informedSize, momentumSize))
                    <= OrderRequest.MAX_QUANTITY, "agent sizes must not exceed " + OrderRequest.MAX_QUANTITY);
            require(inUnitInterval(noiseProbability) && inUnitInterval(informedProbability)
                    && inUnitInterval(momentumProbability) && inUnitInterval(noiseMarketRatio),
                    "probabilities must be in [0, 1]");
            require(analyticsTrigger != null, "analytics trigger is required");
            require(analyticsTradeInterval > 0 && analyticsTradeWindow > 0 && analyticsLevels > 0,
                    "analytics windows must be positive");
            require(analyticsVolatilityWindow >= 2, "analytics volatility window must be at least 2");
            return new SimulationConfig(this);
        }

        private static boolean inUnitInterval(double v) {
            return v >= 0 && v <= 1;
        }

        private static void require(boolean condition, String message) {
            if (!condition) {
                throw new IllegalArgumentException(message);
            }
        }
    }
}
