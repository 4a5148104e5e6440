package com.marketsim.core.agent;

import com.marketsim.core.SimulationConfig;

import java.util.Random;

/**
 * The closed set of agent behaviours, each also the factory for its agents.
 */
public enum AgentType {
    MARKET_MAKER("mm") {
        @Override
        public TradingAgent create(int id, String symbol, SimulationConfig config, Random random) {
            return new MarketMaker(id, symbol, config, random);
        }

        @Override
        public int count(SimulationConfig config) {
            return config.marketMakers();
        }
    },
    NOISE("noise") {
        @Override
        public TradingAgent create(int id, String symbol, SimulationConfig config, Random random) {
            return new NoiseTrader(id, symbol, config, random);
        }

        @Override
        public int count(SimulationConfig config) {
            return config.noiseTraders();
        }
    },
    INFORMED("informed") {
        @Override
        public TradingAgent create(int id, String symbol, SimulationConfig config, Random random) {
            return new InformedTrader(id, symbol, config, random);
        }

        @Override
        public int count(SimulationConfig config) {
            return config.informedTraders();
        }
    },
    MOMENTUM("momentum") {
        @Override
        public TradingAgent create(int id, String symbol, SimulationConfig config, Random random) {
            return new MomentumTrader(id, symbol, config, random);
        }

        @Override
        public int count(SimulationConfig config) {
            return config.momentumTraders();
        }
    };

    private final String prefix;

    AgentType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public abstract TradingAgent create(int id, String symbol, SimulationConfig config, Random random);

    /**
     * How many agents of this type the configuration asks for.
     */
    public abstract int count(SimulationConfig config);
}
